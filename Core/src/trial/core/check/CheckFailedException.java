package trial.core.check;

/**
 * Raised by a test body when one of its checks does not hold.
 *
 * This is an {@link AssertionError} so that assertion libraries and Trial's own checks are reported the same way.
 */
public final class CheckFailedException extends AssertionError {

    public CheckFailedException(String message) {
        super(message);
    }
}
