package trial.core.output;

import com.google.gson.JsonObject;

/**
 * The totals of one run.
 *
 * {@link RunSummary#ran}: the number of tests whose body actually executed.
 * {@link RunSummary#failed}: the number of tests that failed, including pending ones.
 * {@link RunSummary#elapsedNanos}: the wall time of the run in nanoseconds.
 */
public final class RunSummary {
    public final int ran;
    public final int failed;
    public final long elapsedNanos;

    RunSummary(int ran, int failed, long elapsedNanos) {
        this.ran = ran;
        this.failed = failed;
        this.elapsedNanos = elapsedNanos;
    }

    public double elapsedSeconds() {
        return this.elapsedNanos / 1_000_000_000.0;
    }

    /**
     * Returns the summary as the JSON object consumed by scripts: {@code {"success":..,"failures":..,"time":..}}.
     */
    public String toJsonString() {
        JsonObject summary = new JsonObject();
        summary.addProperty("success", this.ran);
        summary.addProperty("failures", this.failed);
        summary.addProperty("time", elapsedSeconds());
        return summary.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RunSummary)) {
            return false;
        }
        RunSummary otherSummary = (RunSummary) other;
        return (this.ran == otherSummary.ran) && (this.failed == otherSummary.failed) && (this.elapsedNanos == otherSummary.elapsedNanos);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * this.ran + this.failed) + Long.hashCode(this.elapsedNanos);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { ran: " + this.ran + ", failed: " + this.failed + ", elapsed (ns): " + this.elapsedNanos + " }";
    }
}
