package trial.core.exception;

/**
 * Thrown when the arguments of a test binary, a case selection or an option default from the environment are
 * malformed. The message is meant to be shown to the user as is.
 */
public final class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }
}
