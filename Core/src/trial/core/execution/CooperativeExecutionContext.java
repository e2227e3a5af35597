package trial.core.execution;

import trial.core.execution.type.ExecutionTask;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs each step on a single scheduler thread that tests may also use to schedule their own continuations.
 *
 * A test suspends by returning a stage that completes later, whether on the scheduler, on an executor of its own or in
 * response to some external event. The scheduler stays free while the test is suspended, but the next step is not
 * started until the current one has resolved.
 */
public final class CooperativeExecutionContext implements ExecutionContext {
    private static final Logger LOGGER = Logger.forClass(CooperativeExecutionContext.class);
    private final ExecutorService scheduler;

    private CooperativeExecutionContext(ExecutorService scheduler) {
        ObjectChecker.assertNonNull(scheduler);
        this.scheduler = scheduler;
    }

    /**
     * Creates a context with its own scheduler thread.
     */
    public static CooperativeExecutionContext create() {
        return new CooperativeExecutionContext(Executors.newSingleThreadExecutor((runnable) -> {
            Thread thread = new Thread(runnable, "TrialScheduler");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * Returns the scheduler steps are started on.
     */
    public ExecutorService scheduler() {
        return this.scheduler;
    }

    @Override
    public <A> Outcome runStep(ExecutionTask<A> task, A argument) throws InterruptedException {
        ObjectChecker.assertNonNull(task);

        CompletableFuture<Outcome> outcome = CompletableFuture
                .supplyAsync(() -> task.execute(argument), this.scheduler)
                .thenCompose((stage) -> stage);
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw StepFailures.rethrow(e.getCause());
        }
    }

    @Override
    public void close() {
        this.scheduler.shutdown();
        try {
            if (!this.scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.log("Scheduler still busy after shutdown; forcing it.");
                this.scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            this.scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + (this.scheduler.isShutdown() ? " { [shutdown] }" : " { [running] }");
    }
}
