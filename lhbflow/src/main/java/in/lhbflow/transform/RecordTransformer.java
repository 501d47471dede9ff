package in.lhbflow.transform;

import in.lhbflow.infrastructure.provider.response.NormalizedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns adapter records into rows ready for a target table.
 *
 * Steps: align columns, derive {@code net_amt} for seats, normalize {@code trade_date} to
 * {@code yyyy-MM-dd}, coerce numeric and text columns, then de-duplicate on the table key
 * keeping the last occurrence. Rows missing a key column are skipped.
 */
public class RecordTransformer {
    private static final Logger log = LoggerFactory.getLogger(RecordTransformer.class);

    private final ColumnAligner aligner;

    public RecordTransformer(ColumnAligner aligner) {
        this.aligner = aligner;
    }

    public RecordTransformer() {
        this(new ColumnAligner(ColumnSynonyms.loadDefault()));
    }

    public record TransformResult(
        TargetTable table,
        List<NormalizedRow> rows,
        Set<String> unmatchedColumns,
        int duplicatesDropped,
        int skippedRows
    ) {
        public TransformResult {
            rows = List.copyOf(rows);
            unmatchedColumns = Set.copyOf(unmatchedColumns);
        }
    }

    public TransformResult transform(List<NormalizedRow> records, TargetTable table) {
        ColumnAligner.AlignmentResult alignment = aligner.align(records, table);

        Map<List<Object>, NormalizedRow> byKey = new LinkedHashMap<>();
        int skipped = 0;
        int duplicates = 0;

        for (NormalizedRow row : alignment.rows()) {
            Map<String, Object> values = new LinkedHashMap<>(row.asMap());

            if (table == TargetTable.SEAT_DAILY && values.get("net_amt") == null) {
                values.put("net_amt", toNumber(values.get("buy_amt")) - toNumber(values.get("sell_amt")));
            }

            if (values.containsKey("trade_date")) {
                String date = normalizeDate(values.get("trade_date"));
                if (date == null) {
                    log.warn("[RecordTransformer] Unparseable trade_date '{}', skipping row", values.get("trade_date"));
                    skipped++;
                    continue;
                }
                values.put("trade_date", date);
            }

            for (Map.Entry<String, Object> e : values.entrySet()) {
                if (TargetTable.NUMERIC_COLUMNS.contains(e.getKey())) {
                    e.setValue(toNumber(e.getValue()));
                } else if (TargetTable.TEXT_COLUMNS.contains(e.getKey())) {
                    e.setValue(e.getValue() == null ? "" : String.valueOf(e.getValue()));
                }
            }

            List<Object> key = new ArrayList<>();
            boolean missingKey = false;
            for (String column : table.keyColumns()) {
                Object value = values.get(column);
                if (value == null || String.valueOf(value).isBlank()) {
                    missingKey = true;
                    break;
                }
                key.add(value);
            }
            if (missingKey) {
                skipped++;
                continue;
            }

            if (byKey.remove(key) != null) {
                duplicates++;
            }
            byKey.put(key, NormalizedRow.of(values));
        }

        if (skipped > 0) {
            log.warn("[RecordTransformer] Skipped {} {} rows without a usable key {}", skipped, table.tableName(), table.keyColumns());
        }
        log.info("[RecordTransformer] {}: {} records in, {} rows out, {} duplicates dropped",
            table.tableName(), records.size(), byKey.size(), duplicates);
        return new TransformResult(table, new ArrayList<>(byKey.values()), alignment.unmatchedColumns(), duplicates, skipped);
    }

    /**
     * Numeric coercion; null, blank, NaN and unparseable values give 0.
     */
    static double toNumber(Object value) {
        double d;
        if (value instanceof Number) {
            d = ((Number) value).doubleValue();
        } else if (value == null) {
            return 0.0;
        } else {
            String s = String.valueOf(value).trim().replace(",", "");
            if (s.isEmpty()) {
                return 0.0;
            }
            try {
                d = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return Double.isNaN(d) || Double.isInfinite(d) ? 0.0 : d;
    }

    /**
     * Date as {@code yyyy-MM-dd}; accepts {@code yyyyMMdd} and a trailing time part. Null when unparseable.
     */
    static String normalizeDate(Object value) {
        if (value instanceof LocalDate) {
            return value.toString();
        }
        if (value == null) {
            return null;
        }
        String s = String.valueOf(value).trim();
        int space = s.indexOf(' ');
        if (space > 0) {
            s = s.substring(0, space);
        }
        int t = s.indexOf('T');
        if (t > 0) {
            s = s.substring(0, t);
        }
        try {
            if (s.length() == 8 && s.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(s, DateTimeFormatter.BASIC_ISO_DATE).toString();
            }
            return LocalDate.parse(s.replace('/', '-')).toString();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
