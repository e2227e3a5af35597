package trial.core.util;

/**
 * A logger for the harness's own diagnostics. It is off unless the {@value #ENABLE_PROPERTY} system property is true
 * or {@link #globalEnable()} was called.
 *
 * Lines go to whatever stderr is installed when they are written. While a test's output is being captured that is the
 * test's output file, which is where a line about that test belongs; the console's stdout, which may carry the JSON
 * summary, is never written to.
 */
public final class Logger {
    public static final String ENABLE_PROPERTY = "trial.enable_logger";
    private static volatile boolean globalEnabled = Boolean.parseBoolean(System.getProperty(ENABLE_PROPERTY));
    private final String className;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getSimpleName());
    }

    public static void globalDisable() {
        globalEnabled = false;
    }

    public static void globalEnable() {
        globalEnabled = true;
    }

    public static boolean isGloballyEnabled() {
        return globalEnabled;
    }

    /**
     * Logs the specified message, prefixed by the logging class and the current thread, if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled) {
            System.err.println("[" + Thread.currentThread().getName() + "] " + this.className + ": " + message);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { class: " + this.className + ", enabled: " + globalEnabled + " }";
    }
}
