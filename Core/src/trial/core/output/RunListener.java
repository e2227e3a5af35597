package trial.core.output;

import trial.core.execution.Outcome;
import trial.core.identity.TestPath;

/**
 * Notified by the executor as each test of a run starts and finishes. Both calls for one test happen outside of that
 * test's output capture, and tests are reported one at a time in execution order.
 */
public interface RunListener {

    /**
     * Invoked right before a test starts.
     *
     * @param path The path of the test.
     */
    public void onStart(TestPath path);

    /**
     * Invoked once the outcome of a test is known.
     *
     * @param path The path of the test.
     * @param outcome The outcome of the test.
     */
    public void onResult(TestPath path, Outcome outcome);
}
