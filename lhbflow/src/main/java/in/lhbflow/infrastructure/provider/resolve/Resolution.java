package in.lhbflow.infrastructure.provider.resolve;

import in.lhbflow.infrastructure.provider.response.NormalizedRow;

import java.util.List;

/**
 * Result of one fallback resolution: rows of the successful attempt (empty otherwise) and the
 * trace of every attempt made.
 */
public record Resolution(ResolutionOutcome outcome, List<NormalizedRow> rows, List<AttemptTrace> trace) {

    public Resolution {
        rows = List.copyOf(rows);
        trace = List.copyOf(trace);
    }

    public boolean isSuccess() {
        return outcome == ResolutionOutcome.SUCCESS;
    }

    /**
     * True when every attempt lacked or lost the session.
     */
    public boolean isSessionUnavailable() {
        return outcome == ResolutionOutcome.SESSION_LOST;
    }

    public int attempts() {
        return trace.size();
    }
}
