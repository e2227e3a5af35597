package trial.core.exception;

/**
 * Thrown when the output of a test cannot be redirected into its output file. Capturing output is not optional, so
 * this aborts the whole run.
 */
public final class OutputCaptureException extends RuntimeException {

    public OutputCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
