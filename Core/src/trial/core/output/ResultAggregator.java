package trial.core.output;

import trial.core.execution.Outcome;
import trial.core.util.ObjectChecker;

import java.util.List;

/**
 * Turns the outcomes of a finished run into its {@link RunSummary}.
 */
public final class ResultAggregator {

    private ResultAggregator() {}

    /**
     * Counts the tests that ran and the tests that failed.
     *
     * @param outcomes The outcome of every test of the run.
     * @param elapsedNanos The wall time of the run.
     * @return the summary.
     */
    public static RunSummary summarize(List<Outcome> outcomes, long elapsedNanos) {
        ObjectChecker.assertNonNull(outcomes);
        ObjectChecker.assertNonNegative(elapsedNanos);

        int ran = 0;
        int failed = 0;
        for (Outcome outcome : outcomes) {
            if (outcome.hasRun()) {
                ran++;
            }
            if (outcome.isFailure()) {
                failed++;
            }
        }
        return new RunSummary(ran, failed, elapsedNanos);
    }
}
