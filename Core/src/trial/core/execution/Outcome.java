package trial.core.execution;

import trial.core.exception.UnreachableException;
import trial.core.util.ObjectChecker;

/**
 * The classified result of attempting to run one test.
 *
 * {@link Outcome#status}: what happened.
 * {@link Outcome#faultKind}: the category of the fault, only set when the status is {@link ExecutionStatus#FAULT}.
 * {@link Outcome#message}: the failure message, only set for failed checks, faults and pending tests.
 */
public final class Outcome {
    private static final Outcome OK = new Outcome(ExecutionStatus.OK, null, null);
    private static final Outcome SKIPPED = new Outcome(ExecutionStatus.SKIPPED, null, null);

    public final ExecutionStatus status;
    public final FaultKind faultKind;
    public final String message;

    private Outcome(ExecutionStatus status, FaultKind faultKind, String message) {
        this.status = status;
        this.faultKind = faultKind;
        this.message = message;
    }

    public static Outcome ok() {
        return OK;
    }

    public static Outcome skipped() {
        return SKIPPED;
    }

    public static Outcome checkFailed(String message) {
        ObjectChecker.assertNonNull(message);
        return new Outcome(ExecutionStatus.CHECK_FAILED, null, message);
    }

    public static Outcome fault(FaultKind kind, String message) {
        ObjectChecker.assertNonNull(kind, message);
        return new Outcome(ExecutionStatus.FAULT, kind, message);
    }

    public static Outcome pending(String message) {
        ObjectChecker.assertNonNull(message);
        return new Outcome(ExecutionStatus.PENDING, null, message);
    }

    /**
     * Returns true iff this outcome is the result of actually executing a test body, whatever its result.
     */
    public boolean hasRun() {
        switch (this.status) {
            case OK:
            case CHECK_FAILED:
            case FAULT:
                return true;
            case SKIPPED:
            case PENDING:
                return false;
            default:
                throw new UnreachableException("unknown status: " + this.status);
        }
    }

    /**
     * Returns true iff this outcome counts towards the failures of a run. Pending tests count as failures even though
     * they did not run.
     */
    public boolean isFailure() {
        switch (this.status) {
            case CHECK_FAILED:
            case FAULT:
            case PENDING:
                return true;
            case OK:
            case SKIPPED:
                return false;
            default:
                throw new UnreachableException("unknown status: " + this.status);
        }
    }

    /**
     * Returns true iff this outcome produces an error report: a failed check or a fault.
     */
    public boolean isError() {
        return (this.status == ExecutionStatus.CHECK_FAILED) || (this.status == ExecutionStatus.FAULT);
    }

    /**
     * Returns the line describing this error, as echoed once the test is done. Null if this outcome is not an error.
     */
    public String describeError() {
        if (this.status == ExecutionStatus.CHECK_FAILED) {
            return this.message;
        } else if (this.status == ExecutionStatus.FAULT) {
            return "[" + this.faultKind + "] " + this.message;
        } else {
            return null;
        }
    }

    @Override
    public String toString() {
        if (this.status == ExecutionStatus.FAULT) {
            return this.getClass().getSimpleName() + " { status: " + this.status + ", kind: " + this.faultKind + " }";
        }
        return this.getClass().getSimpleName() + " { status: " + this.status + " }";
    }
}
