package trial.core.output;

import trial.core.exception.OutputCaptureException;
import trial.core.execution.Outcome;
import trial.core.identity.TestPath;
import trial.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * The rendered reports of every test of a run that failed a check or raised a fault, most recent first.
 *
 * A report carries the test's captured output when there is one, since that holds both what the test printed and the
 * error it ended with. Reports are recorded and read by the single thread driving the run.
 */
public final class ErrorReports {
    private final LinkedList<String> reports = new LinkedList<>();
    private final RunDirectory runDirectory;
    private final boolean verbose;

    private ErrorReports(RunDirectory runDirectory, boolean verbose) {
        ObjectChecker.assertNonNull(runDirectory);
        this.runDirectory = runDirectory;
        this.verbose = verbose;
    }

    public static ErrorReports forRun(RunDirectory runDirectory, boolean verbose) {
        return new ErrorReports(runDirectory, verbose);
    }

    /**
     * Renders and records the report of the specified test if its outcome is an error. Other outcomes are ignored.
     *
     * @param path The path of the test.
     * @param description The description of the test.
     * @param outcome The outcome of the test.
     */
    public void record(TestPath path, String description, Outcome outcome) {
        ObjectChecker.assertNonNull(path, description, outcome);
        if (outcome.isError()) {
            this.reports.addFirst("-- " + path.display() + " [" + description + "] Failed --\n" + logsOf(path, outcome));
        }
    }

    /**
     * Returns every report, most recent first.
     */
    public List<String> mostRecentFirst() {
        return Collections.unmodifiableList(new ArrayList<>(this.reports));
    }

    /**
     * Returns every report in the order the tests ran.
     */
    public List<String> inExecutionOrder() {
        List<String> ordered = new ArrayList<>(this.reports);
        Collections.reverse(ordered);
        return ordered;
    }

    /**
     * Returns the report of the last test that failed, or null if there is none.
     */
    public String mostRecent() {
        return this.reports.peekFirst();
    }

    public boolean isEmpty() {
        return this.reports.isEmpty();
    }

    private String logsOf(TestPath path, Outcome outcome) {
        File outputFile = this.runDirectory.outputFile(path);
        if (this.verbose || !outputFile.exists()) {
            return outcome.describeError() + "\n";
        }

        try {
            String output = new String(Files.readAllBytes(outputFile.toPath()), StandardCharsets.UTF_8);
            return "in `" + outputFile.getPath() + "`:\n" + output;
        } catch (IOException e) {
            throw new OutputCaptureException("Unable to read captured output of " + path.display(), e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { reports: " + this.reports.size() + " }";
    }
}
