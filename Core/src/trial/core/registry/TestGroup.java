package trial.core.registry;

import trial.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named group of test cases. The case at position {@code i} is registered under the path {@code (name, i)}.
 */
public final class TestGroup<A> {
    public final String name;
    public final List<TestCase<A>> testCases;

    private TestGroup(String name, List<TestCase<A>> testCases) {
        ObjectChecker.assertNonNull(name, testCases);
        this.name = name;
        this.testCases = Collections.unmodifiableList(new ArrayList<>(testCases));
    }

    public static <A> TestGroup<A> of(String name, List<TestCase<A>> testCases) {
        return new TestGroup<>(name, testCases);
    }

    @SafeVarargs
    public static <A> TestGroup<A> of(String name, TestCase<A>... testCases) {
        return new TestGroup<>(name, Arrays.asList(testCases));
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + ", cases: " + this.testCases.size() + " }";
    }
}
