package trial.core.execution;

import trial.core.execution.type.ExecutionTask;

/**
 * The host a run executes its tests on.
 *
 * Whatever the host, a step is only done once its outcome has resolved, including any time the test spends suspended,
 * so a caller going through the steps in order never has two tests in flight.
 */
public interface ExecutionContext extends AutoCloseable {

    /**
     * Runs one step and waits until its outcome has resolved.
     *
     * @param task The task to run.
     * @param argument The argument to run it with.
     * @return the outcome.
     * @throws InterruptedException If interrupted while waiting.
     */
    public <A> Outcome runStep(ExecutionTask<A> task, A argument) throws InterruptedException;

    /**
     * Releases whatever the host holds. A closed context runs no further steps.
     */
    @Override
    public void close();
}
