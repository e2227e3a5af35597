package trial.core.execution;

/**
 * The category of an uncaught fault raised by a test body.
 */
public enum FaultKind {
    FAILURE("failure"),
    INVALID("invalid"),
    EXCEPTION("exception");

    public final String label;

    FaultKind(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return this.label;
    }
}
