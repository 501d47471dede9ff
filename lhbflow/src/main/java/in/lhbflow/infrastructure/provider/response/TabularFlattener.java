package in.lhbflow.infrastructure.provider.response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts column-packed rows into one record per element.
 *
 * <p>A history answer usually arrives as a single row such as
 * {@code {thscode: "000001.SZ", time: [d1, d2], close: [c1, c2]}}; flattening gives
 * {@code {thscode, time: d1, close: c1}} and {@code {thscode, time: d2, close: c2}}.
 *
 * <p>Rules:
 * <ul>
 *   <li>Records produced = length of the longest array (or nested record set). Shorter arrays pad with null.</li>
 *   <li>Scalar fields are repeated on every record.</li>
 *   <li>Nested mappings holding arrays are flattened and merged; inner fields override outer ones.</li>
 *   <li>When every array is empty there are no records.</li>
 *   <li>Rows without arrays come back unchanged, so flattening twice is the same as once.</li>
 * </ul>
 */
public class TabularFlattener {
    private static final Logger log = LoggerFactory.getLogger(TabularFlattener.class);

    public List<NormalizedRow> flattenAll(List<NormalizedRow> rows) {
        List<NormalizedRow> out = new ArrayList<>();
        for (NormalizedRow row : rows) {
            out.addAll(flatten(row));
        }
        return out;
    }

    public List<NormalizedRow> flatten(NormalizedRow row) {
        if (!needsFlattening(row.asMap())) {
            return List.of(row);
        }

        Map<String, List<Object>> arrays = new LinkedHashMap<>();
        Map<String, List<NormalizedRow>> nested = new LinkedHashMap<>();
        int n = 0;
        int shortest = Integer.MAX_VALUE;

        for (Map.Entry<String, Object> e : row.asMap().entrySet()) {
            Object value = e.getValue();
            List<Object> list = NormalizedRow.asList(value);
            if (list != null) {
                arrays.put(e.getKey(), list);
                n = Math.max(n, list.size());
                shortest = Math.min(shortest, list.size());
            } else if (value instanceof Map && needsFlattening((Map<?, ?>) value)) {
                List<NormalizedRow> records = flatten(NormalizedRow.of(stringKeys((Map<?, ?>) value)));
                nested.put(e.getKey(), records);
                n = Math.max(n, records.size());
                shortest = Math.min(shortest, records.size());
            }
        }

        if (n == 0) {
            return List.of();
        }
        if (shortest < n) {
            log.debug("[TabularFlattener] Ragged arrays (shortest {}, longest {}), padding with nulls", shortest, n);
        }

        Map<String, Set<String>> nestedFields = new LinkedHashMap<>();
        for (Map.Entry<String, List<NormalizedRow>> e : nested.entrySet()) {
            Set<String> fields = new LinkedHashSet<>();
            for (NormalizedRow r : e.getValue()) {
                fields.addAll(r.fields());
            }
            nestedFields.put(e.getKey(), fields);
        }

        List<NormalizedRow> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : row.asMap().entrySet()) {
                String field = e.getKey();
                if (nested.containsKey(field)) {
                    continue;
                }
                List<Object> list = arrays.get(field);
                if (list != null) {
                    values.put(field, i < list.size() ? list.get(i) : null);
                } else {
                    values.put(field, e.getValue());
                }
            }
            for (Map.Entry<String, List<NormalizedRow>> e : nested.entrySet()) {
                List<NormalizedRow> records = e.getValue();
                if (i < records.size()) {
                    values.putAll(records.get(i).asMap());
                } else {
                    for (String field : nestedFields.get(e.getKey())) {
                        values.put(field, null);
                    }
                }
            }

            if (needsFlattening(values)) {
                out.addAll(flatten(NormalizedRow.of(values)));
            } else {
                out.add(NormalizedRow.of(values));
            }
        }
        return out;
    }

    /**
     * Split delimited string fields into arrays, then flatten.
     *
     * <p>Used for seat answers where one stock row lists every seat in a single
     * {@code "a|b|c"} string per field. Each part is trimmed; non-string values are left alone.
     */
    public List<NormalizedRow> expandDelimited(NormalizedRow row, Collection<String> fields, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        Pattern splitter = Pattern.compile(Pattern.quote(delimiter));
        Map<String, Object> values = new LinkedHashMap<>(row.asMap());
        for (String field : fields) {
            Object value = values.get(field);
            if (value instanceof CharSequence) {
                List<Object> parts = new ArrayList<>();
                for (String part : splitter.split(value.toString(), -1)) {
                    parts.add(part.trim());
                }
                values.put(field, parts);
            }
        }
        return flatten(NormalizedRow.of(values));
    }

    private static boolean needsFlattening(Map<?, ?> values) {
        for (Object v : values.values()) {
            if (NormalizedRow.isArrayValue(v)) {
                return true;
            }
            if (v instanceof Map && needsFlattening((Map<?, ?>) v)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }
}
