package trial.core.execution;

import trial.core.check.PendingTestException;
import trial.core.check.SkippedTestException;
import trial.core.check.TestFailureException;
import trial.core.execution.type.AsyncTestBody;
import trial.core.execution.type.ExecutionTask;
import trial.core.identity.TestPath;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * The fault-isolation boundary around a test body.
 *
 * A protected task never fails: whatever the body throws, synchronously or through the stage it returns, is turned
 * into an {@link Outcome}. Failed checks are kept apart from unexpected faults so that they can be reported
 * differently.
 */
public final class ProtectedExecutor {
    private static final Logger LOGGER = Logger.forClass(ProtectedExecutor.class);
    static final String CHECK_FAILURE_PREFIX = "Test error: ";

    private ProtectedExecutor() {}

    /**
     * Wraps the specified body so that executing it always yields an outcome.
     *
     * @param path The path of the test, used for logging.
     * @param body The test body.
     * @return the protected task.
     */
    public static <A> ExecutionTask<A> protect(TestPath path, AsyncTestBody<A> body) {
        ObjectChecker.assertNonNull(path, body);

        return (argument) -> {
            CompletionStage<?> stage;
            try {
                stage = body.run(argument);
            } catch (Throwable t) {
                return CompletableFuture.completedFuture(classify(path, t));
            }

            if (stage == null) {
                return CompletableFuture.completedFuture(Outcome.ok());
            }
            return stage.handle((ignored, error) -> (error == null) ? Outcome.ok() : classify(path, unwrap(error)));
        };
    }

    /**
     * Classifies the specified throwable raised by a test body.
     *
     * @param path The path of the test that raised it.
     * @param error The throwable.
     * @return the outcome.
     */
    static Outcome classify(TestPath path, Throwable error) {
        // An interrupt raised by a body belongs to that test: the flag is not carried over to the thread driving the
        // run, where it would abort the wait on the next test.
        LOGGER.log("Test " + path.display() + " raised " + error.getClass().getName());

        if (error instanceof AssertionError) {
            return Outcome.checkFailed(CHECK_FAILURE_PREFIX + messageOf(error) + stackTraceOf(error));
        } else if (error instanceof TestFailureException) {
            return Outcome.fault(FaultKind.FAILURE, messageOf(error) + stackTraceOf(error));
        } else if (error instanceof IllegalArgumentException) {
            return Outcome.fault(FaultKind.INVALID, messageOf(error) + stackTraceOf(error));
        } else if (error instanceof PendingTestException) {
            return Outcome.pending(messageOf(error));
        } else if (error instanceof SkippedTestException) {
            return Outcome.skipped();
        } else {
            return Outcome.fault(FaultKind.EXCEPTION, error.toString() + stackTraceOf(error));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (((current instanceof CompletionException) || (current instanceof ExecutionException)) && (current.getCause() != null)) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        return (error.getMessage() == null) ? error.toString() : error.getMessage();
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        String rendered = trace.toString();
        return rendered.isEmpty() ? "" : "\n" + rendered;
    }
}
