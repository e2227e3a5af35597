package trial.core.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Either some data or the list of errors that prevented producing it.
 *
 * An error result can absorb further errors through {@link #withError(String)}, so that a sequence of steps can keep
 * going after the first failure and report everything that went wrong at the end.
 */
public final class Result<D> {
    private final boolean success;
    private final D data;
    private final List<String> errors;

    private Result(boolean success, D data, List<String> errors) {
        this.success = success;
        this.data = data;
        this.errors = errors;
    }

    public static <D> Result<D> successful(D data) {
        return new Result<>(true, data, Collections.emptyList());
    }

    public static <D> Result<D> error(String error) {
        return new Result<>(false, null, Collections.singletonList(error));
    }

    /**
     * Returns an error result holding all of this result's errors followed by the given one. A successful result's
     * data is discarded.
     *
     * @param error The error to append.
     * @return the error result.
     */
    public Result<D> withError(String error) {
        List<String> allErrors = new ArrayList<>(this.errors);
        allErrors.add(error);
        return new Result<>(false, null, Collections.unmodifiableList(allErrors));
    }

    public boolean isSuccess() {
        return this.success;
    }

    public D getData() {
        return this.data;
    }

    /**
     * Returns the first error, or null if this result is successful.
     */
    public String getError() {
        return this.errors.isEmpty() ? null : this.errors.get(0);
    }

    /**
     * Returns every error in the order it was recorded.
     */
    public List<String> getErrors() {
        return this.errors;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + (this.success ? "success: " + this.data : "errors: " + this.errors) + " }";
    }
}
