package trial.core.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown once registration has finished if any of the registered groups were invalid. Holds every error that was
 * collected, in registration order.
 */
public final class RegistrationException extends RuntimeException {
    private final List<String> errors;

    public RegistrationException(List<String> errors) {
        super(String.join("\n", errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<String> getErrors() {
        return this.errors;
    }
}
