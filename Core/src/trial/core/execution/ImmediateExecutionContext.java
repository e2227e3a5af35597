package trial.core.execution;

import trial.core.execution.type.ExecutionTask;
import trial.core.util.ObjectChecker;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs each step on the calling thread. A synchronous test is done by the time it returns; should a test hand back a
 * stage that is still pending, the calling thread blocks until it completes.
 */
public final class ImmediateExecutionContext implements ExecutionContext {

    public static ImmediateExecutionContext create() {
        return new ImmediateExecutionContext();
    }

    @Override
    public <A> Outcome runStep(ExecutionTask<A> task, A argument) throws InterruptedException {
        ObjectChecker.assertNonNull(task);
        CompletableFuture<Outcome> outcome = task.execute(argument).toCompletableFuture();
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw StepFailures.rethrow(e.getCause());
        }
    }

    @Override
    public void close() {
        // Nothing held.
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
