package trial.core.identity;

/**
 * How long a test is expected to take. A run is configured with a minimum tier: running at {@link #QUICK} leaves out
 * every {@link #SLOW} test, running at {@link #SLOW} selects everything.
 */
public enum SpeedTier {
    QUICK,
    SLOW;

    /**
     * Returns true iff a test of this tier should run when the run's minimum tier is the specified one.
     *
     * @param minimum The minimum tier configured for the run.
     * @return whether or not a test of this tier is selected.
     */
    public boolean isSelectedAt(SpeedTier minimum) {
        return (minimum == SLOW) || (this == QUICK);
    }
}
