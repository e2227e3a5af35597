package trial.core.registry;

import trial.core.execution.type.AsyncTestBody;
import trial.core.execution.type.TestBody;
import trial.core.identity.SpeedTier;
import trial.core.util.ObjectChecker;

import java.util.concurrent.CompletableFuture;

/**
 * A test case as written by the user: what it checks, how slow it is and its body. It gets its {@code TestPath} once
 * it is registered as part of a {@link TestGroup}.
 */
public final class TestCase<A> {
    public final String description;
    public final SpeedTier speed;
    public final AsyncTestBody<A> body;

    private TestCase(String description, SpeedTier speed, AsyncTestBody<A> body) {
        ObjectChecker.assertNonNull(description, speed, body);
        this.description = description;
        this.speed = speed;
        this.body = body;
    }

    /**
     * Creates a test case whose body is done when it returns.
     */
    public static <A> TestCase<A> of(String description, SpeedTier speed, TestBody<A> body) {
        ObjectChecker.assertNonNull(body);
        return new TestCase<>(description, speed, (argument) -> {
            body.run(argument);
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * Creates a test case whose body is done when the stage it returns completes.
     */
    public static <A> TestCase<A> async(String description, SpeedTier speed, AsyncTestBody<A> body) {
        return new TestCase<>(description, speed, body);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { description: " + this.description + ", speed: " + this.speed + " }";
    }
}
