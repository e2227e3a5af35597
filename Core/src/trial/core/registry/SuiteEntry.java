package trial.core.registry;

import trial.core.execution.type.ExecutionTask;
import trial.core.identity.TestPath;
import trial.core.util.ObjectChecker;

/**
 * A registered test: its path and the task that runs it.
 */
public final class SuiteEntry<A> {
    public final TestPath path;
    public final ExecutionTask<A> task;

    private SuiteEntry(TestPath path, ExecutionTask<A> task) {
        ObjectChecker.assertNonNull(path, task);
        this.path = path;
        this.task = task;
    }

    public static <A> SuiteEntry<A> of(TestPath path, ExecutionTask<A> task) {
        return new SuiteEntry<>(path, task);
    }

    /**
     * Returns an entry for the same path running the specified task instead.
     */
    public SuiteEntry<A> withTask(ExecutionTask<A> task) {
        return new SuiteEntry<>(this.path, task);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { path: " + this.path.display() + " }";
    }
}
