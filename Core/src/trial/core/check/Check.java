package trial.core.check;

import org.hamcrest.Matcher;
import org.hamcrest.StringDescription;

import java.util.Objects;

/**
 * The checks available to test bodies.
 *
 * Every method here signals through an exception that the protected executor knows how to classify, so a body can
 * simply call them and let the first failing check end the test.
 */
public final class Check {

    private Check() {}

    /**
     * Checks that {@code actual} equals {@code expected}.
     *
     * @param message What is being checked.
     * @param expected The expected value.
     * @param actual The actual value.
     */
    public static <T> void equal(String message, T expected, T actual) {
        if (!Objects.equals(expected, actual)) {
            throw new CheckFailedException("Error " + message + ": expecting " + expected + ", got " + actual + ".");
        }
    }

    /**
     * Checks that {@code actual} satisfies the given matcher.
     *
     * @param message What is being checked.
     * @param actual The actual value.
     * @param matcher The matcher the value must satisfy.
     */
    public static <T> void that(String message, T actual, Matcher<? super T> matcher) {
        if (!matcher.matches(actual)) {
            StringDescription description = new StringDescription();
            description.appendText("Error ").appendText(message).appendText(": expecting ").appendDescriptionOf(matcher).appendText(", but ");
            matcher.describeMismatch(actual, description);
            throw new CheckFailedException(description.toString() + ".");
        }
    }

    /**
     * Fails the current test with a check failure.
     *
     * @param message The reason.
     */
    public static void fail(String message) {
        throw new CheckFailedException(message);
    }

    /**
     * Marks the current test as not implemented yet.
     *
     * @param message What is left to do.
     */
    public static void todo(String message) {
        throw new PendingTestException(message);
    }

    /**
     * Skips the current test.
     */
    public static void skip() {
        throw new SkippedTestException();
    }
}
