package trial.core.exception;

/**
 * Thrown when a test is registered under a path whose file key is already taken by another test in the same suite.
 */
public final class DuplicateTestException extends RuntimeException {

    public DuplicateTestException(String message) {
        super(message);
    }
}
