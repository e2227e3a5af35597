package trial.core.execution;

import trial.core.execution.type.ExecutionTask;
import trial.core.filter.TestFilter;
import trial.core.identity.SpeedTier;
import trial.core.output.ErrorReports;
import trial.core.output.OutputCapture;
import trial.core.output.RunListener;
import trial.core.registry.SuiteEntry;
import trial.core.registry.TestSuite;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a list of tests one at a time, in list order.
 *
 * Every entry is first wrapped in output capture and then checked against the run's minimum speed tier; entries that
 * are too slow are replaced by a skip so that they are still reported. Each step runs through the
 * {@link ExecutionContext} and is fully resolved before the next one starts, since output capture only has one
 * channel to hand out.
 */
public final class SequentialExecutor<A> {
    private static final Logger LOGGER = Logger.forClass(SequentialExecutor.class);
    private final ExecutionContext context;
    private final OutputCapture outputCapture;
    private final TestSuite<A> suite;
    private final SpeedTier minimumSpeed;
    private final RunListener listener;
    private final ErrorReports errorReports;

    private SequentialExecutor(ExecutionContext context, OutputCapture outputCapture, TestSuite<A> suite, SpeedTier minimumSpeed, RunListener listener, ErrorReports errorReports) {
        ObjectChecker.assertNonNull(context, outputCapture, suite, minimumSpeed, listener, errorReports);
        this.context = context;
        this.outputCapture = outputCapture;
        this.suite = suite;
        this.minimumSpeed = minimumSpeed;
        this.listener = listener;
        this.errorReports = errorReports;
    }

    public static <A> SequentialExecutor<A> newExecutor(ExecutionContext context, OutputCapture outputCapture, TestSuite<A> suite, SpeedTier minimumSpeed, RunListener listener, ErrorReports errorReports) {
        return new SequentialExecutor<>(context, outputCapture, suite, minimumSpeed, listener, errorReports);
    }

    /**
     * Runs every entry and returns their outcomes, in the same order.
     *
     * @param entries The entries to run.
     * @param argument The argument each test receives.
     * @return the outcomes.
     * @throws InterruptedException If interrupted while waiting on a test.
     */
    public List<Outcome> perform(List<SuiteEntry<A>> entries, A argument) throws InterruptedException {
        ObjectChecker.assertNonNull(entries);

        List<SuiteEntry<A>> prepared = new ArrayList<>(entries.size());
        for (SuiteEntry<A> entry : entries) {
            prepared.add(selectSpeed(entry.withTask(this.outputCapture.wrap(entry.path, entry.task))));
        }

        List<Outcome> outcomes = new ArrayList<>(prepared.size());
        for (SuiteEntry<A> entry : prepared) {
            this.listener.onStart(entry.path);
            Outcome outcome = this.context.runStep(entry.task, argument);
            LOGGER.log("Test " + entry.path.display() + " finished: " + outcome);

            this.errorReports.record(entry.path, this.suite.descriptionOf(entry.path), outcome);
            this.listener.onResult(entry.path, outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private SuiteEntry<A> selectSpeed(SuiteEntry<A> entry) {
        if (this.suite.speedOf(entry.path).isSelectedAt(this.minimumSpeed)) {
            return entry;
        }
        ExecutionTask<A> skip = TestFilter.skipTask();
        return entry.withTask(skip);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { context: " + this.context + ", minimum speed: " + this.minimumSpeed + " }";
    }
}
