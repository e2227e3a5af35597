package trial.core.output;

import trial.core.execution.Outcome;
import trial.core.execution.type.ExecutionTask;
import trial.core.identity.TestPath;
import trial.core.util.ObjectChecker;

import java.util.concurrent.CompletionStage;

/**
 * Captures everything a test writes to stdout and stderr into the test's own output file.
 *
 * The redirect is held from the moment the test starts until its outcome is known, including any time the test spends
 * suspended, and it is released whatever the test does. When the test fails with an error, the error is written at the
 * end of its output file and, if echoing is enabled, repeated on the restored stdout so that it stays visible.
 *
 * In verbose mode nothing is captured.
 */
public final class OutputCapture {
    private final OutputChannel channel;
    private final RunDirectory runDirectory;
    private final boolean verbose;
    private final boolean echoErrors;

    private OutputCapture(OutputChannel channel, RunDirectory runDirectory, boolean verbose, boolean echoErrors) {
        ObjectChecker.assertNonNull(channel, runDirectory);
        this.channel = channel;
        this.runDirectory = runDirectory;
        this.verbose = verbose;
        this.echoErrors = echoErrors;
    }

    /**
     * Creates a capture writing into the specified run directory.
     *
     * @param channel The output channel to redirect.
     * @param runDirectory The directory holding the output files.
     * @param verbose Whether capturing is disabled.
     * @param echoErrors Whether errors are repeated on stdout once a test is done.
     * @return the capture.
     */
    public static OutputCapture into(OutputChannel channel, RunDirectory runDirectory, boolean verbose, boolean echoErrors) {
        return new OutputCapture(channel, runDirectory, verbose, echoErrors);
    }

    /**
     * Wraps the specified task so that its output is captured into the output file of the specified path.
     *
     * @param path The path of the test.
     * @param task The task to wrap.
     * @return the wrapped task, or the task itself in verbose mode.
     */
    public <A> ExecutionTask<A> wrap(TestPath path, ExecutionTask<A> task) {
        ObjectChecker.assertNonNull(path, task);
        if (this.verbose) {
            return task;
        }

        return (argument) -> {
            OutputChannel.Redirect redirect = this.channel.acquire(this.runDirectory.outputFile(path));

            CompletionStage<Outcome> outcome;
            try {
                outcome = task.execute(argument);
            } catch (RuntimeException | Error e) {
                redirect.close();
                throw e;
            }

            return outcome.whenComplete((result, error) -> release(redirect, result));
        };
    }

    private void release(OutputChannel.Redirect redirect, Outcome outcome) {
        String errorLine = ((outcome != null) && outcome.isError()) ? outcome.describeError() : null;
        try {
            if (errorLine != null) {
                redirect.writeLine(errorLine);
            }
        } finally {
            redirect.close();
        }

        if ((errorLine != null) && this.echoErrors) {
            redirect.originalOut().println(errorLine);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { verbose: " + this.verbose + ", echo errors: " + this.echoErrors + " }";
    }
}
