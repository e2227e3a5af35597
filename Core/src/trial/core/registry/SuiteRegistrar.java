package trial.core.registry;

import trial.core.exception.RegistrationException;
import trial.core.execution.ProtectedExecutor;
import trial.core.identity.TestPath;
import trial.core.type.Result;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds a {@link TestSuite} out of groups of test cases.
 *
 * Invalid group names do not stop registration. Each one is recorded and registration keeps validating the groups
 * that follow, so that {@link #build()} can report every offending name at once. Once an invalid name has been seen
 * no further group is added to the suite, since the suite will never run.
 *
 * A duplicate path is a different matter: it throws straight away from {@link #register(TestGroup)}.
 */
public final class SuiteRegistrar<A> {
    private static final Logger LOGGER = Logger.forClass(SuiteRegistrar.class);
    private static final String VALID_NAME = "^[a-zA-Z0-9_\\- ]+$";
    private static final Pattern VALID_NAME_PATTERN = Pattern.compile(VALID_NAME);
    private Result<TestSuite<A>> suite = Result.successful(TestSuite.empty());
    private int maxLabelLength = 0;

    public static <A> SuiteRegistrar<A> newRegistrar() {
        return new SuiteRegistrar<>();
    }

    /**
     * Registers every case of the specified group.
     *
     * @param group The group to register.
     * @return this registrar.
     */
    public SuiteRegistrar<A> register(TestGroup<A> group) {
        ObjectChecker.assertNonNull(group);

        if (!VALID_NAME_PATTERN.matcher(group.name).matches()) {
            LOGGER.log("Rejected group name: " + group.name);
            this.suite = this.suite.withError("Error: \"" + group.name + "\" is not a valid test label (must match " + VALID_NAME + ").");
            return this;
        }

        if (this.suite.isSuccess()) {
            TestSuite<A> testSuite = this.suite.getData();
            List<TestCase<A>> cases = group.testCases;
            for (int i = 0; i < cases.size(); i++) {
                TestCase<A> testCase = cases.get(i);
                TestPath path = TestPath.of(group.name, i);
                testSuite.add(path, normalizeDescription(testCase.description), testCase.speed, ProtectedExecutor.protect(path, testCase.body));
            }
            this.maxLabelLength = Math.max(this.maxLabelLength, group.name.length());
            LOGGER.log("Registered " + cases.size() + " test(s) in group " + group.name);
        }
        return this;
    }

    /**
     * Registers each of the specified groups, in order.
     *
     * @param groups The groups to register.
     * @return this registrar.
     */
    public SuiteRegistrar<A> registerAll(List<TestGroup<A>> groups) {
        ObjectChecker.assertNonNull(groups);
        for (TestGroup<A> group : groups) {
            register(group);
        }
        return this;
    }

    /**
     * Returns the registration result so far: the suite, or every error recorded in registration order.
     */
    public Result<TestSuite<A>> result() {
        return this.suite;
    }

    /**
     * Returns the suite.
     *
     * @return the suite.
     * @throws RegistrationException If any registered group had an invalid name.
     */
    public TestSuite<A> build() {
        if (!this.suite.isSuccess()) {
            throw new RegistrationException(this.suite.getErrors());
        }
        return this.suite.getData();
    }

    /**
     * Returns the length of the longest group name registered so far.
     */
    public int getMaxLabelLength() {
        return this.maxLabelLength;
    }

    static String normalizeDescription(String description) {
        if (description.isEmpty() || description.endsWith(".")) {
            return description;
        }
        return description + ".";
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.suite + " }";
    }
}
