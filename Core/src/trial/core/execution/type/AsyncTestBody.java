package trial.core.execution.type;

import java.util.concurrent.CompletionStage;

/**
 * The body of a test that may suspend. It is done when the stage it returns completes, and it fails if that stage
 * completes exceptionally.
 */
@FunctionalInterface
public interface AsyncTestBody<A> {

    /**
     * Starts the test.
     *
     * @param argument The argument every test of the run receives.
     * @return the stage that completes when the test is done.
     * @throws Exception If the test fails before it suspends.
     */
    public CompletionStage<?> run(A argument) throws Exception;
}
