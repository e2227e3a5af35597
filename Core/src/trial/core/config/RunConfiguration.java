package trial.core.config;

import trial.core.identity.SpeedTier;
import trial.core.util.ObjectChecker;

import java.io.File;
import java.util.Locale;
import java.util.Map;

/**
 * The options of one run.
 *
 * {@link RunConfiguration#outputDirectory}: the base directory run directories are created in.
 * {@link RunConfiguration#verbose}: whether test output is left on the console instead of being captured.
 * {@link RunConfiguration#compact}: whether each result is reported as a single character.
 * {@link RunConfiguration#showErrors}: whether every error report is printed at the end, not just the most recent.
 * {@link RunConfiguration#minimumSpeed}: the slowest tier of tests that still runs.
 * {@link RunConfiguration#json}: whether the only thing printed is the JSON summary.
 */
public final class RunConfiguration {
    public static final String OUTPUT_DIR_VARIABLE = "TRIAL_OUTPUT_DIR";
    public static final String VERBOSE_VARIABLE = "TRIAL_VERBOSE";
    public static final String COMPACT_VARIABLE = "TRIAL_COMPACT";
    public static final String SHOW_ERRORS_VARIABLE = "TRIAL_SHOW_ERRORS";
    public static final String QUICK_TESTS_VARIABLE = "TRIAL_QUICK_TESTS";
    public static final String JSON_VARIABLE = "TRIAL_JSON";

    public final File outputDirectory;
    public final boolean verbose;
    public final boolean compact;
    public final boolean showErrors;
    public final SpeedTier minimumSpeed;
    public final boolean json;

    private RunConfiguration(File outputDirectory, boolean verbose, boolean compact, boolean showErrors, SpeedTier minimumSpeed, boolean json) {
        ObjectChecker.assertNonNull(outputDirectory, minimumSpeed);
        this.outputDirectory = outputDirectory;
        this.verbose = verbose;
        this.compact = compact;
        this.showErrors = showErrors;
        this.minimumSpeed = minimumSpeed;
        this.json = json;
    }

    /**
     * Returns the output directory used when none is configured: {@code _build/_tests} under the working directory.
     */
    public static File defaultOutputDirectory() {
        return new File(new File(System.getProperty("user.dir"), "_build"), "_tests");
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { output: " + this.outputDirectory + ", verbose: " + this.verbose + ", compact: " + this.compact
                + ", show errors: " + this.showErrors + ", minimum speed: " + this.minimumSpeed + ", json: " + this.json + " }";
    }

    public static final class Builder {
        private File outputDirectory = defaultOutputDirectory();
        private boolean verbose = false;
        private boolean compact = false;
        private boolean showErrors = false;
        private SpeedTier minimumSpeed = SpeedTier.SLOW;
        private boolean json = false;

        public static Builder newBuilder() {
            return new Builder();
        }

        /**
         * Returns a builder whose defaults are taken from the specified environment. Unset variables keep the built-in
         * defaults.
         *
         * @param environment The environment variables.
         * @return the builder.
         * @throws IllegalArgumentException If a boolean variable holds something other than a boolean.
         */
        public static Builder fromEnvironment(Map<String, String> environment) {
            ObjectChecker.assertNonNull(environment);
            Builder builder = new Builder();
            if (environment.containsKey(OUTPUT_DIR_VARIABLE)) {
                builder.outputDirectory(new File(environment.get(OUTPUT_DIR_VARIABLE)));
            }
            builder.verbose(flag(environment, VERBOSE_VARIABLE));
            builder.compact(flag(environment, COMPACT_VARIABLE));
            builder.showErrors(flag(environment, SHOW_ERRORS_VARIABLE));
            builder.quickTestsOnly(flag(environment, QUICK_TESTS_VARIABLE));
            builder.json(flag(environment, JSON_VARIABLE));
            return builder;
        }

        public Builder outputDirectory(File outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder compact(boolean compact) {
            this.compact = compact;
            return this;
        }

        public Builder showErrors(boolean showErrors) {
            this.showErrors = showErrors;
            return this;
        }

        public Builder quickTestsOnly(boolean quickTestsOnly) {
            this.minimumSpeed = quickTestsOnly ? SpeedTier.QUICK : SpeedTier.SLOW;
            return this;
        }

        public Builder json(boolean json) {
            this.json = json;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(this.outputDirectory, this.verbose, this.compact, this.showErrors, this.minimumSpeed, this.json);
        }

        private static boolean flag(Map<String, String> environment, String variable) {
            String value = environment.get(variable);
            if (value == null) {
                return false;
            }
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "1":
                case "true":
                case "yes":
                case "y":
                    return true;
                case "":
                case "0":
                case "false":
                case "no":
                case "n":
                    return false;
                default:
                    throw new IllegalArgumentException("environment variable " + variable + ": invalid value \"" + value + "\", expected a boolean");
            }
        }
    }
}
