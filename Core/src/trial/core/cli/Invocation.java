package trial.core.cli;

import trial.core.config.RunConfiguration;
import trial.core.filter.TestFilter;
import trial.core.util.ObjectChecker;

/**
 * A parsed command line: the command, the selection it applies to and the run options.
 */
public final class Invocation {
    public final Command command;
    public final TestFilter filter;
    public final RunConfiguration configuration;

    Invocation(Command command, TestFilter filter, RunConfiguration configuration) {
        ObjectChecker.assertNonNull(command, filter, configuration);
        this.command = command;
        this.filter = filter;
        this.configuration = configuration;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { command: " + this.command + ", filter: " + this.filter + ", " + this.configuration + " }";
    }
}
