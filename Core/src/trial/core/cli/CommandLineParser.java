package trial.core.cli;

import trial.core.config.RunConfiguration;
import trial.core.exception.ParseException;
import trial.core.filter.CaseSelection;
import trial.core.filter.CaseSetParser;
import trial.core.filter.TestFilter;
import trial.core.util.ObjectChecker;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses the arguments of a test binary.
 *
 * We expect the arguments to look like:
 *
 * [test|list] [NAME_REGEX] [CASES] [OPTIONS]
 *
 * With no command every test is run. {@code test} runs the tests selected by NAME_REGEX and CASES and reports the
 * others as skipped; {@code list} lists the selected tests. NAME_REGEX is searched for in each group name and CASES is
 * a selection of indices such as {@code 4,6-10,19}. Options may appear anywhere and default to the value of their
 * environment variable.
 */
public final class CommandLineParser {
    private final Map<String, String> environment;

    private CommandLineParser(Map<String, String> environment) {
        ObjectChecker.assertNonNull(environment);
        this.environment = environment;
    }

    /**
     * Creates a parser taking its option defaults from the specified environment.
     */
    public static CommandLineParser withEnvironment(Map<String, String> environment) {
        return new CommandLineParser(environment);
    }

    /**
     * Parses the specified arguments.
     *
     * @param args The program arguments.
     * @return the invocation.
     * @throws ParseException If the arguments or an environment default are malformed.
     */
    public Invocation parse(String[] args) throws ParseException {
        ObjectChecker.assertNonNull((Object) args);

        RunConfiguration.Builder configuration;
        try {
            configuration = RunConfiguration.Builder.fromEnvironment(this.environment);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage());
        }

        List<String> positionals = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    return new Invocation(Command.HELP, TestFilter.acceptAll(), configuration.build());
                case "-o":
                case "--output":
                    if (i + 1 == args.length) {
                        throw new ParseException("option " + arg + " needs an argument");
                    }
                    configuration.outputDirectory(new File(args[++i]));
                    break;
                case "-v":
                case "--verbose":
                    configuration.verbose(true);
                    break;
                case "-c":
                case "--compact":
                    configuration.compact(true);
                    break;
                case "-e":
                case "--show-errors":
                    configuration.showErrors(true);
                    break;
                case "-q":
                case "--quick-tests":
                    configuration.quickTestsOnly(true);
                    break;
                case "--json":
                    configuration.json(true);
                    break;
                default:
                    if (arg.startsWith("--output=")) {
                        configuration.outputDirectory(new File(arg.substring("--output=".length())));
                    } else if (arg.startsWith("-") && (arg.length() > 1)) {
                        throw new ParseException("unknown option " + arg);
                    } else {
                        positionals.add(arg);
                    }
            }
        }

        return toInvocation(positionals, configuration.build());
    }

    private static Invocation toInvocation(List<String> positionals, RunConfiguration configuration) throws ParseException {
        if (positionals.isEmpty()) {
            return new Invocation(Command.RUN_ALL, TestFilter.acceptAll(), configuration);
        }

        Command command;
        switch (positionals.get(0)) {
            case "test":
                command = Command.TEST;
                break;
            case "list":
                command = Command.LIST;
                break;
            default:
                throw new ParseException("unknown command " + positionals.get(0));
        }

        if (positionals.size() > 3) {
            throw new ParseException("too many arguments, don't know what to do with " + positionals.get(3));
        }

        Pattern namePattern = (positionals.size() > 1) ? parseRegex(positionals.get(1)) : null;
        CaseSelection cases = (positionals.size() > 2) ? parseCases(positionals.get(2)) : null;
        return new Invocation(command, TestFilter.matching(namePattern, cases), configuration);
    }

    private static Pattern parseRegex(String regex) throws ParseException {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ParseException("invalid value '" + regex + "' for NAME_REGEX: " + e.getDescription());
        }
    }

    private static CaseSelection parseCases(String cases) throws ParseException {
        try {
            return CaseSetParser.parse(cases);
        } catch (ParseException e) {
            throw new ParseException("invalid value '" + cases + "' for CASES: " + e.getMessage());
        }
    }

    /**
     * Returns the usage text of a test binary with the specified name.
     */
    public static String usage(String name) {
        return "Usage: " + name + " [test|list] [NAME_REGEX] [CASES] [OPTIONS]\n"
                + "\n"
                + "Commands:\n"
                + "  (none)        Run all the tests.\n"
                + "  test          Run a subset of the tests; the others are reported as skipped.\n"
                + "  list          List all available tests.\n"
                + "\n"
                + "Arguments:\n"
                + "  NAME_REGEX    A regular expression matching the names of tests to run.\n"
                + "  CASES         A comma-separated list of test case numbers (and ranges of numbers) to run, e.g: '4,6-10,19'.\n"
                + "\n"
                + "Options:\n"
                + "  -o, --output DIR    Where to store the log files of the tests (env " + RunConfiguration.OUTPUT_DIR_VARIABLE + ").\n"
                + "  -v, --verbose       Display the test outputs; they are then not kept for further inspection (env " + RunConfiguration.VERBOSE_VARIABLE + ").\n"
                + "  -c, --compact       Compact the output of the tests (env " + RunConfiguration.COMPACT_VARIABLE + ").\n"
                + "  -e, --show-errors   Display every test error (env " + RunConfiguration.SHOW_ERRORS_VARIABLE + ").\n"
                + "  -q, --quick-tests   Run only the quick tests (env " + RunConfiguration.QUICK_TESTS_VARIABLE + ").\n"
                + "      --json          Display JSON for the results, to be used by a script (env " + RunConfiguration.JSON_VARIABLE + ").\n";
    }
}
