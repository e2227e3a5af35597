package trial.core.execution;

/**
 * Hands back the cause of a step that failed to produce an outcome. Protected tasks never fail, so this only happens
 * when something around the test broke, such as output capture, and the run has to stop.
 */
final class StepFailures {

    private StepFailures() {}

    static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException("step did not resolve to an outcome.", cause);
    }
}
