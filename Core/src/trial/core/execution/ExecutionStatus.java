package trial.core.execution;

/**
 * The kind of an {@link Outcome}.
 */
public enum ExecutionStatus {
    OK,
    CHECK_FAILED,
    FAULT,
    SKIPPED,
    PENDING
}
