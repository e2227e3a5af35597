package trial.core.cli;

/**
 * What an invocation of a test binary asks for.
 */
public enum Command {
    RUN_ALL,
    TEST,
    LIST,
    HELP
}
