package in.lhbflow.infrastructure.provider;

import java.util.Collection;

/**
 * Outcome of an adapter fetch.
 */
public enum FetchStatus {
    /** At least one record. */
    DATA,
    /** The terminal answered, nothing matched. A normal outcome. */
    NO_DATA,
    /** Calls failed; trying again later may help. */
    TRANSIENT_FAILURE,
    /** No login could be obtained. */
    SESSION_UNAVAILABLE,
    /** The calling thread was interrupted. */
    CANCELLED;

    /**
     * Combine per-unit statuses (one per day or per code) into the status of the whole fetch.
     */
    public static FetchStatus aggregate(Collection<FetchStatus> units) {
        if (units.contains(DATA)) {
            return DATA;
        }
        if (units.contains(CANCELLED)) {
            return CANCELLED;
        }
        if (units.contains(SESSION_UNAVAILABLE)) {
            return SESSION_UNAVAILABLE;
        }
        if (units.contains(TRANSIENT_FAILURE)) {
            return TRANSIENT_FAILURE;
        }
        return NO_DATA;
    }

    public boolean isFailure() {
        return this == TRANSIENT_FAILURE || this == SESSION_UNAVAILABLE || this == CANCELLED;
    }
}
