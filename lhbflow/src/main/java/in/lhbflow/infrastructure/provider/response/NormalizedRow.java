package in.lhbflow.infrastructure.provider.response;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable ordered mapping from field name to value.
 *
 * Values are whatever the upstream delivered: strings, numbers, booleans, nulls, lists or
 * nested maps. A row with no list values is a flat record ready for storage.
 */
public final class NormalizedRow {

    private final Map<String, Object> values;

    private NormalizedRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static NormalizedRow of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new NormalizedRow(new LinkedHashMap<>(values));
    }

    public static NormalizedRow empty() {
        return new NormalizedRow(new LinkedHashMap<>());
    }

    public Object get(String field) {
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    /**
     * Field names in insertion order.
     */
    public List<String> fields() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Copy of this row with one field set, appended when new.
     */
    public NormalizedRow with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new NormalizedRow(copy);
    }

    /**
     * True when at least one field holds a list or array.
     */
    public boolean hasArrayValues() {
        for (Object v : values.values()) {
            if (isArrayValue(v)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isArrayValue(Object value) {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    /**
     * View an array-valued field as a list; anything else gives null.
     */
    public static List<Object> asList(Object value) {
        if (value instanceof List) {
            return new ArrayList<>((List<?>) value);
        }
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value != null && value.getClass().isArray()) {
            int len = java.lang.reflect.Array.getLength(value);
            List<Object> out = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                out.add(java.lang.reflect.Array.get(value, i));
            }
            return out;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedRow)) return false;
        return values.equals(((NormalizedRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
