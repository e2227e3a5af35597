package trial.core.exception;

/**
 * Thrown when a switch over a test status, a fault kind or a command meets a constant it has no branch for.
 */
public final class UnreachableException extends RuntimeException {

    public UnreachableException(String message) {
        super(message);
    }
}
