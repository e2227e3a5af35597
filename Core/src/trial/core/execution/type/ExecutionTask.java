package trial.core.execution.type;

import trial.core.execution.Outcome;

import java.util.concurrent.CompletionStage;

/**
 * A test that has been wrapped for execution. Its stage always completes with an {@link Outcome} instead of failing.
 */
@FunctionalInterface
public interface ExecutionTask<A> {

    /**
     * Executes the task.
     *
     * @param argument The argument every test of the run receives.
     * @return the stage holding the outcome.
     */
    public CompletionStage<Outcome> execute(A argument);
}
