package com.driftsentinel.core.model;

/**
 * Reachable configurations of a detector's hysteresis counter.
 *
 * <p>
 * The counter itself is the only stored state; this enum is derived from it
 * for logging, results and tests.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorState {

    /** Counter is zero: the last window did not trigger the sentinel layer. */
    IDLE,

    /** Counter is positive but below the confirm depth. */
    SUSPECT,

    /** Counter has reached the confirm depth; the confirm layer runs. */
    CONFIRMED;

    /**
     * Derive the state from a hysteresis count.
     *
     * @param count                 current hysteresis count, non-negative
     * @param consecutiveSentinels  configured confirm depth
     * @return matching state
     */
    public static DetectorState of(int count, int consecutiveSentinels) {
        if (count <= 0) {
            return IDLE;
        }
        return count >= consecutiveSentinels ? CONFIRMED : SUSPECT;
    }
}
