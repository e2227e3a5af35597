package trial.core.runner;

import trial.core.cli.CommandLineParser;
import trial.core.cli.Invocation;
import trial.core.config.RunConfiguration;
import trial.core.exception.DuplicateTestException;
import trial.core.exception.EmptySelectionException;
import trial.core.exception.OutputCaptureException;
import trial.core.exception.ParseException;
import trial.core.exception.UnreachableException;
import trial.core.execution.ExecutionContext;
import trial.core.execution.ImmediateExecutionContext;
import trial.core.execution.Outcome;
import trial.core.execution.SequentialExecutor;
import trial.core.identity.TestPath;
import trial.core.output.ConsoleReporter;
import trial.core.output.ErrorReports;
import trial.core.output.OutputCapture;
import trial.core.output.OutputChannel;
import trial.core.output.ResultAggregator;
import trial.core.output.RunDirectory;
import trial.core.output.RunSummary;
import trial.core.registry.SuiteEntry;
import trial.core.registry.SuiteRegistrar;
import trial.core.registry.TestGroup;
import trial.core.registry.TestSuite;
import trial.core.type.Result;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The entry point of a test binary: registers its groups, parses its command line and runs, lists or filters its tests.
 *
 * The exit code of a run is its number of failures, capped at {@link #MAX_FAILURE_EXIT_CODE}. Anything that makes the
 * run invalid before a single test executes (an invalid or duplicate test name, a malformed command line, a selection
 * matching nothing, an output directory that cannot be used) exits with {@link #FATAL_EXIT_CODE} instead.
 */
public final class TrialRunner<A> {
    public static final int FATAL_EXIT_CODE = 124;
    public static final int MAX_FAILURE_EXIT_CODE = 123;
    private static final Logger LOGGER = Logger.forClass(TrialRunner.class);
    private final String name;
    private final List<TestGroup<A>> groups;
    private final Map<String, String> environment;
    private final Supplier<ExecutionContext> contextFactory;
    private final PrintStream out;
    private final PrintStream err;

    private TrialRunner(String name, List<TestGroup<A>> groups, Map<String, String> environment, Supplier<ExecutionContext> contextFactory, PrintStream out, PrintStream err) {
        ObjectChecker.assertNonNull(name, groups, environment, contextFactory, out, err);
        this.name = name;
        this.groups = groups;
        this.environment = environment;
        this.contextFactory = contextFactory;
        this.out = out;
        this.err = err;
    }

    /**
     * Runs the specified groups of argument-less tests with the process environment and then exits the process with
     * the resulting exit code.
     *
     * @param name The name of the test binary.
     * @param args The program arguments.
     * @param groups The groups of tests.
     */
    public static void runAndExit(String name, String[] args, List<TestGroup<Void>> groups) {
        TrialRunner<Void> runner = Builder.<Void>newBuilder(name).addGroups(groups).build();
        System.exit(runner.run(args, null));
    }

    /**
     * Runs according to the specified arguments.
     *
     * @param args The program arguments.
     * @param argument The argument handed to every test.
     * @return the exit code.
     */
    public int run(String[] args, A argument) {
        ObjectChecker.assertNonNull((Object) args);

        SuiteRegistrar<A> registrar = SuiteRegistrar.newRegistrar();
        try {
            registrar.registerAll(this.groups);
        } catch (DuplicateTestException e) {
            this.err.println(e.getMessage());
            return FATAL_EXIT_CODE;
        }

        Result<TestSuite<A>> registration = registrar.result();
        if (!registration.isSuccess()) {
            for (String error : registration.getErrors()) {
                this.err.println(error);
            }
            return FATAL_EXIT_CODE;
        }
        TestSuite<A> suite = registration.getData();

        Invocation invocation;
        try {
            invocation = CommandLineParser.withEnvironment(this.environment).parse(args);
        } catch (ParseException e) {
            this.err.println(this.name + ": " + e.getMessage());
            this.err.println("Try '" + this.name + " --help' for more information.");
            return FATAL_EXIT_CODE;
        }
        LOGGER.log("Parsed invocation: " + invocation);

        RunDirectory runDirectory = RunDirectory.of(invocation.configuration.outputDirectory, RunDirectory.newRunId());
        ConsoleReporter reporter = ConsoleReporter.to(this.out, invocation.configuration, suite, registrar.getMaxLabelLength(), runDirectory);

        try {
            switch (invocation.command) {
                case HELP:
                    this.out.print(CommandLineParser.usage(this.name));
                    return 0;
                case LIST:
                    reporter.printBanner(this.name);
                    reporter.printListing(sortedPaths(invocation.filter.drop(suite.tests())));
                    return 0;
                case RUN_ALL:
                    reporter.printBanner(this.name);
                    return execute(suite, suite.tests(), argument, invocation.configuration, runDirectory, reporter);
                case TEST:
                    if (invocation.filter.drop(suite.tests()).isEmpty()) {
                        throw new EmptySelectionException("Invalid request (no tests to run, filter skipped everything)!");
                    }
                    reporter.printBanner(this.name);
                    return execute(suite, invocation.filter.substitute(suite.tests()), argument, invocation.configuration, runDirectory, reporter);
                default:
                    throw new UnreachableException("unknown command: " + invocation.command);
            }
        } catch (EmptySelectionException | OutputCaptureException e) {
            this.err.println(e.getMessage());
            return FATAL_EXIT_CODE;
        } catch (IOException e) {
            this.err.println("Unable to prepare the output directory: " + e.getMessage());
            return FATAL_EXIT_CODE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            this.err.println("Interrupted while running tests.");
            return FATAL_EXIT_CODE;
        }
    }

    private int execute(TestSuite<A> suite, List<SuiteEntry<A>> entries, A argument, RunConfiguration configuration, RunDirectory runDirectory, ConsoleReporter reporter) throws IOException, InterruptedException {
        runDirectory.prepare(this.name);

        ErrorReports errorReports = ErrorReports.forRun(runDirectory, configuration.verbose);
        OutputCapture outputCapture = OutputCapture.into(OutputChannel.system(), runDirectory, configuration.verbose, !configuration.json);

        long startTime = System.nanoTime();
        List<Outcome> outcomes;
        try (ExecutionContext context = this.contextFactory.get()) {
            SequentialExecutor<A> executor = SequentialExecutor.newExecutor(context, outputCapture, suite, configuration.minimumSpeed, reporter, errorReports);
            outcomes = executor.perform(entries, argument);
        }
        long elapsed = System.nanoTime() - startTime;

        RunSummary summary = ResultAggregator.summarize(outcomes, elapsed);
        LOGGER.log("Run finished: " + summary);
        reporter.printSummary(summary, errorReports);
        return Math.min(summary.failed, MAX_FAILURE_EXIT_CODE);
    }

    private static <A> List<TestPath> sortedPaths(List<SuiteEntry<A>> entries) {
        List<TestPath> paths = new ArrayList<>(entries.size());
        for (SuiteEntry<A> entry : entries) {
            paths.add(entry.path);
        }
        Collections.sort(paths);
        return paths;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + ", groups: " + this.groups.size() + " }";
    }

    public static final class Builder<A> {
        private final String name;
        private final List<TestGroup<A>> groups = new ArrayList<>();
        private Map<String, String> environment = System.getenv();
        private Supplier<ExecutionContext> contextFactory = ImmediateExecutionContext::create;
        private PrintStream out = null;
        private PrintStream err = null;

        private Builder(String name) {
            ObjectChecker.assertNonNull(name);
            this.name = name;
        }

        public static <A> Builder<A> newBuilder(String name) {
            return new Builder<>(name);
        }

        public Builder<A> addGroup(TestGroup<A> group) {
            ObjectChecker.assertNonNull(group);
            this.groups.add(group);
            return this;
        }

        public Builder<A> addGroups(List<TestGroup<A>> groups) {
            ObjectChecker.assertNonNull(groups);
            for (TestGroup<A> group : groups) {
                addGroup(group);
            }
            return this;
        }

        /**
         * Sets the environment option defaults are read from. Defaults to the process environment.
         */
        public Builder<A> environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Sets the factory of the host each run executes on. Defaults to {@link ImmediateExecutionContext}.
         */
        public Builder<A> executionContext(Supplier<ExecutionContext> contextFactory) {
            this.contextFactory = contextFactory;
            return this;
        }

        /**
         * Sets the streams reports and fatal errors are printed on. Default to the standard streams in place when the
         * runner is built.
         */
        public Builder<A> streams(PrintStream out, PrintStream err) {
            this.out = out;
            this.err = err;
            return this;
        }

        public TrialRunner<A> build() {
            return new TrialRunner<>(
                    this.name,
                    new ArrayList<>(this.groups),
                    this.environment,
                    this.contextFactory,
                    (this.out == null) ? System.out : this.out,
                    (this.err == null) ? System.err : this.err);
        }
    }
}
