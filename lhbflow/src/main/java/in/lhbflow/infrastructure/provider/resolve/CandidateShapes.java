package in.lhbflow.infrastructure.provider.resolve;

import in.lhbflow.infrastructure.terminal.TerminalOperation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds ordered candidate lists for the fallback resolver.
 *
 * <p>The terminal accepts dates as {@code 2024-01-02} or {@code 20240102} depending on account,
 * release and operation, and some reports only answer when filtered per exchange. Candidates are
 * the cartesian product of those variants, the combination that usually works first.
 */
public final class CandidateShapes {

    public enum DateFormatVariant {
        HYPHENATED(DateTimeFormatter.ISO_LOCAL_DATE),
        COMPACT(DateTimeFormatter.BASIC_ISO_DATE),
        /** Empty time parameter; the date travels in the filter only. */
        EMPTY(null);

        private final DateTimeFormatter formatter;

        DateFormatVariant(DateTimeFormatter formatter) {
            this.formatter = formatter;
        }

        public String format(LocalDate date) {
            return formatter == null ? "" : formatter.format(date);
        }
    }

    public enum FilterVariant {
        DATE_ONLY(""),
        SSE(";exchange:SSE"),
        SZSE(";exchange:SZSE");

        private final String suffix;

        FilterVariant(String suffix) {
            this.suffix = suffix;
        }

        public String filter(String dateText) {
            return "date:" + dateText + suffix;
        }

        /**
         * Variant for a market scope code: {@code SSE}, {@code SZSE}, anything else means all.
         */
        public static FilterVariant forMarket(String market) {
            if (market == null) {
                return DATE_ONLY;
            }
            return switch (market.trim().toUpperCase(Locale.ROOT)) {
                case "SSE", "SH" -> SSE;
                case "SZSE", "SZ" -> SZSE;
                default -> DATE_ONLY;
            };
        }
    }

    /** History interval parameters, tried in order. */
    public static final List<String> HISTORY_JSON_PARAMS = List.of("", "Interval:D");

    private CandidateShapes() {}

    /**
     * Data-pool candidates: every date format crossed with every filter variant.
     */
    public static List<InvocationShape> dataPool(TerminalOperation operation, String report, LocalDate date,
                                                 String fields, List<FilterVariant> filters) {
        List<InvocationShape> shapes = new ArrayList<>();
        for (DateFormatVariant dateFormat : DateFormatVariant.values()) {
            String time = dateFormat.format(date);
            String filterDate = dateFormat == DateFormatVariant.EMPTY
                ? DateFormatVariant.HYPHENATED.format(date)
                : time;
            for (FilterVariant filterVariant : filters) {
                String filter = filterVariant.filter(filterDate);
                String description = operation + "(" + report + ", time='" + (time.isEmpty() ? "EMPTY" : time)
                    + "', filter='" + filter + "')";
                shapes.add(InvocationShape.of(description, operation, report, time, filter, fields));
            }
        }
        return shapes;
    }

    public static List<InvocationShape> dataPool(TerminalOperation operation, String report, LocalDate date, String fields) {
        return dataPool(operation, report, date, fields, List.of(FilterVariant.values()));
    }

    /**
     * Basic-data candidates for explicit codes, in both parameter styles the terminal accepts.
     */
    public static List<InvocationShape> basicData(String codes, String indicators, LocalDate date) {
        String day = DateFormatVariant.HYPHENATED.format(date);
        List<InvocationShape> shapes = new ArrayList<>();
        for (String param : List.of("date:" + day, day + ",100")) {
            shapes.add(InvocationShape.of("BASIC_DATA(" + codes + ", param='" + param + "')",
                TerminalOperation.BASIC_DATA, codes, indicators, param));
        }
        return shapes;
    }

    /**
     * History-quote candidates: each interval parameter with hyphenated then compact dates.
     */
    public static List<InvocationShape> historyQuotes(String code, String indicators, LocalDate start, LocalDate end) {
        List<InvocationShape> shapes = new ArrayList<>();
        for (DateFormatVariant dateFormat : List.of(DateFormatVariant.HYPHENATED, DateFormatVariant.COMPACT)) {
            for (String jsonParam : HISTORY_JSON_PARAMS) {
                String from = dateFormat.format(start);
                String to = dateFormat.format(end);
                shapes.add(InvocationShape.of(
                    "HISTORY_QUOTES(" + code + ", param='" + jsonParam + "', " + from + ".." + to + ")",
                    TerminalOperation.HISTORY_QUOTES, code, indicators, jsonParam, from, to));
            }
        }
        return shapes;
    }
}
