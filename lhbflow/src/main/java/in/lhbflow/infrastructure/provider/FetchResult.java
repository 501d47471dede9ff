package in.lhbflow.infrastructure.provider;

import in.lhbflow.domain.model.Query;
import in.lhbflow.infrastructure.provider.resolve.AttemptTrace;
import in.lhbflow.infrastructure.provider.response.NormalizedRow;

import java.util.List;
import java.util.Objects;

/**
 * Typed result of an adapter fetch.
 *
 * @param query       the query as asked
 * @param status      overall status; records are non-empty exactly when it is {@link FetchStatus#DATA}
 * @param records     flat records
 * @param trace       every fallback attempt made, for diagnostics
 * @param failedUnits days or codes whose resolution failed (empty when none)
 */
public record FetchResult(
    Query query,
    FetchStatus status,
    List<NormalizedRow> records,
    List<AttemptTrace> trace,
    List<String> failedUnits
) {
    public FetchResult {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(status, "status");
        records = List.copyOf(records);
        trace = List.copyOf(trace);
        failedUnits = List.copyOf(failedUnits);
        if ((status == FetchStatus.DATA) == records.isEmpty()) {
            throw new IllegalArgumentException("status " + status + " with " + records.size() + " records");
        }
    }

    public boolean hasData() {
        return status == FetchStatus.DATA;
    }

    public int size() {
        return records.size();
    }
}
