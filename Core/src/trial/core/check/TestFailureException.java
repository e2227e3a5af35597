package trial.core.check;

/**
 * Raised by a test body to abort with a plain failure message. Unlike {@link CheckFailedException} this is reported
 * as a fault of kind {@code failure} rather than as a failed check.
 */
public final class TestFailureException extends RuntimeException {

    public TestFailureException(String message) {
        super(message);
    }
}
