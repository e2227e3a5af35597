package trial.core.registry;

import trial.core.exception.DuplicateTestException;
import trial.core.execution.type.ExecutionTask;
import trial.core.identity.SpeedTier;
import trial.core.identity.TestPath;
import trial.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The registered tests, in registration order, along with their descriptions and speed tiers.
 *
 * No two tests of a suite share a {@link TestPath#fileKey()}. A suite is only ever built by the registration phase,
 * on a single thread, and is read-only once a run starts.
 */
public final class TestSuite<A> {
    private final List<SuiteEntry<A>> tests = new ArrayList<>();
    private final Set<String> fileKeys = new HashSet<>();
    private final Map<TestPath, String> descriptions = new HashMap<>();
    private final Map<TestPath, SpeedTier> speeds = new HashMap<>();

    private TestSuite() {}

    public static <A> TestSuite<A> empty() {
        return new TestSuite<>();
    }

    /**
     * Adds the specified test to the end of this suite.
     *
     * @param path The path of the test.
     * @param description The description of the test.
     * @param speed The speed tier of the test.
     * @param task The task running the test.
     * @throws DuplicateTestException If a test with the same file key is already registered. The suite is unchanged.
     */
    public void add(TestPath path, String description, SpeedTier speed, ExecutionTask<A> task) {
        ObjectChecker.assertNonNull(path, description, speed, task);

        if (this.fileKeys.contains(path.fileKey())) {
            throw new DuplicateTestException("Duplicate test name: " + path.groupName);
        }

        this.tests.add(SuiteEntry.of(path, task));
        this.fileKeys.add(path.fileKey());
        this.descriptions.put(path, description);
        this.speeds.put(path, speed);
    }

    /**
     * Returns every test of this suite in registration order.
     */
    public List<SuiteEntry<A>> tests() {
        return Collections.unmodifiableList(this.tests);
    }

    /**
     * Returns the description of the specified test, or the empty string if it is not part of this suite.
     */
    public String descriptionOf(TestPath path) {
        return this.descriptions.getOrDefault(path, "");
    }

    /**
     * Returns the speed tier of the specified test, or {@link SpeedTier#SLOW} if it is not part of this suite.
     */
    public SpeedTier speedOf(TestPath path) {
        return this.speeds.getOrDefault(path, SpeedTier.SLOW);
    }

    public int size() {
        return this.tests.size();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { tests: " + this.tests.size() + " }";
    }
}
