package trial.core.exception;

/**
 * Thrown when a test selection matches none of the registered tests.
 */
public final class EmptySelectionException extends RuntimeException {

    public EmptySelectionException(String message) {
        super(message);
    }
}
