package in.lhbflow.infrastructure.provider.resolve;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Diagnostics for one fallback attempt. Never part of the returned data.
 *
 * @param shapeDescription which candidate was tried
 * @param rawTypeName      shape of the raw answer, {@code none} when no call was made
 * @param statusCode       status code found in the answer, if any
 * @param rowCount         rows after normalization
 * @param latency          time spent in the physical call
 * @param error            why the attempt failed before normalization, null otherwise
 */
public record AttemptTrace(
    String shapeDescription,
    String rawTypeName,
    OptionalInt statusCode,
    int rowCount,
    Duration latency,
    String error
) {
    public static final String NO_CALL = "none";
    public static final String NO_SESSION = "no session";

    public static AttemptTrace failed(String shapeDescription, String error, Duration latency) {
        return new AttemptTrace(shapeDescription, NO_CALL, OptionalInt.empty(), 0, latency, error);
    }

    /**
     * True when the terminal answered and the answer was normalized.
     */
    public boolean reachedUpstream() {
        return error == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(shapeDescription).append(" => ").append(rawTypeName);
        sb.append(", code=").append(statusCode.isPresent() ? String.valueOf(statusCode.getAsInt()) : "none");
        sb.append(", rows=").append(rowCount);
        if (error != null) {
            sb.append(", error=").append(error);
        }
        return sb.toString();
    }
}
