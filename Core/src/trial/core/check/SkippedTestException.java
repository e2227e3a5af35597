package trial.core.check;

/**
 * Raised by a test body that decides at runtime it should not run.
 */
public final class SkippedTestException extends RuntimeException {

    public SkippedTestException() {
        super("skipped");
    }
}
