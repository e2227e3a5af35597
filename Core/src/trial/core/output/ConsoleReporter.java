package trial.core.output;

import trial.core.config.RunConfiguration;
import trial.core.exception.UnreachableException;
import trial.core.execution.Outcome;
import trial.core.identity.TestPath;
import trial.core.registry.TestSuite;
import trial.core.util.ObjectChecker;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Reports a run on the console.
 *
 * The reporter writes to the stream it was created with, which is the real stdout rather than whatever stream is
 * installed while a test's output is being captured. In JSON mode the only thing it prints is the summary object.
 */
public final class ConsoleReporter implements RunListener {
    private static final int STATUS_WIDTH = 20;
    private final PrintStream out;
    private final RunConfiguration configuration;
    private final TestSuite<?> suite;
    private final int maxLabelLength;
    private final RunDirectory runDirectory;

    private ConsoleReporter(PrintStream out, RunConfiguration configuration, TestSuite<?> suite, int maxLabelLength, RunDirectory runDirectory) {
        ObjectChecker.assertNonNull(out, configuration, suite, runDirectory);
        this.out = out;
        this.configuration = configuration;
        this.suite = suite;
        this.maxLabelLength = maxLabelLength;
        this.runDirectory = runDirectory;
    }

    /**
     * Creates a reporter.
     *
     * @param out The stream to report on.
     * @param configuration The run configuration.
     * @param suite The suite, for test descriptions.
     * @param maxLabelLength The length of the longest group name, to align paths.
     * @param runDirectory The run directory, to point at the full results.
     * @return the reporter.
     */
    public static ConsoleReporter to(PrintStream out, RunConfiguration configuration, TestSuite<?> suite, int maxLabelLength, RunDirectory runDirectory) {
        return new ConsoleReporter(out, configuration, suite, maxLabelLength, runDirectory);
    }

    /**
     * Prints the lines introducing a run.
     *
     * @param name The name of the test binary.
     */
    public void printBanner(String name) {
        if (!this.configuration.json) {
            this.out.println("Testing " + name + ".");
            this.out.println("This run has ID `" + this.runDirectory.getRunId() + "`.");
        }
    }

    @Override
    public void onStart(TestPath path) {
        if (this.configuration.json || this.configuration.compact) {
            return;
        }
        this.out.print(padRight(" ...", STATUS_WIDTH) + describe(path));
        this.out.flush();
    }

    @Override
    public void onResult(TestPath path, Outcome outcome) {
        if (this.configuration.json) {
            return;
        }
        if (this.configuration.compact) {
            this.out.print(compactStatusOf(outcome));
        } else {
            this.out.print("\r" + padRight(statusOf(outcome), STATUS_WIDTH) + describe(path) + "\n");
        }
        this.out.flush();
    }

    /**
     * Prints the end of a run: the error reports, if any, and the summary line, or only the JSON object in JSON mode.
     *
     * @param summary The summary of the run.
     * @param errorReports The error reports of the run.
     */
    public void printSummary(RunSummary summary, ErrorReports errorReports) {
        ObjectChecker.assertNonNull(summary, errorReports);

        if (this.configuration.json) {
            this.out.println(summary.toJsonString());
            return;
        }

        if (this.configuration.compact) {
            this.out.println();
        }

        if ((summary.failed > 0) && !errorReports.isEmpty()) {
            if (this.configuration.verbose || this.configuration.showErrors) {
                for (String report : errorReports.inExecutionOrder()) {
                    this.out.println(report);
                }
            } else {
                this.out.println(errorReports.mostRecent());
            }
        }

        if (!this.configuration.compact || (summary.failed > 0)) {
            String fullLogs = this.configuration.verbose
                    ? ""
                    : "The full test results are available in `" + this.runDirectory.directory().getPath() + "`.\n";
            String results = (summary.failed == 0) ? "Test Successful" : summary.failed + " error" + plural(summary.failed) + "!";
            this.out.print(fullLogs + results + String.format(Locale.ROOT, " in %.3fs. %d test%s run.%n", summary.elapsedSeconds(), summary.ran, plural(summary.ran)));
        }
        this.out.flush();
    }

    /**
     * Prints one line per path with its description.
     *
     * @param paths The paths to list, already in the order they should appear.
     */
    public void printListing(List<TestPath> paths) {
        ObjectChecker.assertNonNull(paths);
        for (TestPath path : paths) {
            this.out.println(pathColumn(path) + "    " + this.suite.descriptionOf(path));
        }
        this.out.flush();
    }

    private String describe(TestPath path) {
        return pathColumn(path) + "   " + this.suite.descriptionOf(path);
    }

    private String pathColumn(TestPath path) {
        return padRight(path.groupName, this.maxLabelLength + 8) + String.format(Locale.ROOT, "%3d", path.index);
    }

    static String statusOf(Outcome outcome) {
        switch (outcome.status) {
            case OK:
                return "[OK]";
            case FAULT:
                return "[FAIL]";
            case CHECK_FAILED:
                return "[ERROR]";
            case SKIPPED:
                return "[SKIP]";
            case PENDING:
                return "[TODO]";
            default:
                throw new UnreachableException("unknown status: " + outcome.status);
        }
    }

    static String compactStatusOf(Outcome outcome) {
        switch (outcome.status) {
            case OK:
                return ".";
            case FAULT:
                return "F";
            case CHECK_FAILED:
                return "E";
            case SKIPPED:
                return "S";
            case PENDING:
                return "T";
            default:
                throw new UnreachableException("unknown status: " + outcome.status);
        }
    }

    private static String padRight(String text, int width) {
        StringBuilder padded = new StringBuilder(text);
        while (padded.length() < width) {
            padded.append(' ');
        }
        return padded.toString();
    }

    private static String plural(int count) {
        return (count > 1) ? "s" : "";
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.configuration + " }";
    }
}
