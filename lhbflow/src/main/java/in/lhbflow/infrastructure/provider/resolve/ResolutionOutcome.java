package in.lhbflow.infrastructure.provider.resolve;

public enum ResolutionOutcome {
    /** A candidate passed the success predicate. */
    SUCCESS,
    /** At least one candidate got a clean answer (no status or status 0) without data. */
    EXHAUSTED,
    /** Every candidate failed or answered with an error code. */
    UNAVAILABLE,
    /** Every candidate found no session or was told the session had expired. */
    SESSION_LOST,
    /** The calling thread was interrupted. */
    CANCELLED
}
