package in.lhbflow.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable logical query against the upstream terminal.
 *
 * <p>Validated on construction so a bad query fails before any network activity:
 * codes and indicators must be non-empty and free of blanks, and the date range must not be
 * inverted. Duplicate codes are dropped, first occurrence wins.
 *
 * <p>{@link #ALL_MARKET} selects the whole market for the data-pool kinds; for
 * {@link QueryKind#INSTRUMENT_LIST} the codes name the market scope ({@code *}, {@code SSE},
 * {@code SZSE}).
 */
public record Query(
    List<String> codes,
    LocalDate startDate,
    LocalDate endDate,
    List<String> indicators,
    QueryKind kind
) {
    public static final String ALL_MARKET = "*";

    public Query {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        codes = cleanDistinct(codes, "codes");
        indicators = cleanDistinct(indicators, "indicators");
    }

    public static Builder builder(QueryKind kind) {
        return new Builder(kind);
    }

    /**
     * True when the query targets the whole market rather than a list of instruments.
     */
    public boolean isAllMarket() {
        return codes.contains(ALL_MARKET);
    }

    public String joinedCodes() {
        return String.join(",", codes);
    }

    public String joinedIndicators() {
        return String.join(",", indicators);
    }

    /**
     * Calendar days covered by the query, inclusive on both ends.
     */
    public List<LocalDate> days() {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = startDate; !d.isAfter(endDate); d = d.plusDays(1)) {
            days.add(d);
        }
        return days;
    }

    private static List<String> cleanDistinct(Collection<String> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not contain blank entries");
            }
            distinct.add(value.trim());
        }
        return List.copyOf(distinct);
    }

    /**
     * Builder for Query. Indicators default to the kind's standard set.
     */
    public static class Builder {
        private final QueryKind kind;
        private List<String> codes = List.of();
        private LocalDate startDate;
        private LocalDate endDate;
        private List<String> indicators;

        private Builder(QueryKind kind) {
            this.kind = kind;
        }

        public Builder codes(Collection<String> codes) {
            this.codes = codes == null ? List.of() : new ArrayList<>(codes);
            return this;
        }

        public Builder codes(String... codes) {
            return codes(List.of(codes));
        }

        public Builder allMarket() {
            return codes(ALL_MARKET);
        }

        public Builder between(LocalDate startDate, LocalDate endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
            return this;
        }

        public Builder on(LocalDate date) {
            return between(date, date);
        }

        public Builder indicators(Collection<String> indicators) {
            this.indicators = indicators == null ? null : new ArrayList<>(indicators);
            return this;
        }

        public Builder indicators(String... indicators) {
            return indicators(List.of(indicators));
        }

        public Query build() {
            if (kind == null) {
                throw new IllegalArgumentException("kind must not be null");
            }
            if (startDate == null || endDate == null) {
                throw new IllegalArgumentException("date range must be set");
            }
            List<String> effectiveIndicators = indicators != null ? indicators : kind.defaultIndicators();
            return new Query(codes, startDate, endDate, effectiveIndicators, kind);
        }
    }
}
