package in.lhbflow.infrastructure.provider.response;

import java.util.List;
import java.util.OptionalInt;

/**
 * Uniform view of one upstream answer: optional status code, optional message and rows.
 */
public record NormalizedResult(OptionalInt statusCode, String message, List<NormalizedRow> rows) {

    private static final NormalizedResult EMPTY = new NormalizedResult(OptionalInt.empty(), null, List.of());

    public NormalizedResult {
        statusCode = statusCode == null ? OptionalInt.empty() : statusCode;
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static NormalizedResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }
}
