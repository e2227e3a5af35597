package trial.core.check;

/**
 * Raised by a test body that is deliberately not implemented yet.
 */
public final class PendingTestException extends RuntimeException {

    public PendingTestException(String message) {
        super(message);
    }
}
