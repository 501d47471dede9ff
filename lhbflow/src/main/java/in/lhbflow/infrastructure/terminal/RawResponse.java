package in.lhbflow.infrastructure.terminal;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Untyped result of one physical call to the upstream terminal.
 *
 * <p>The terminal answers the same logical call with tuples, byte-encoded JSON, plain JSON text,
 * nested mappings or bare scalars. Each shape is one variant, tagged by {@link Kind}, so callers
 * dispatch with a {@code switch} on {@link #kind()} instead of sniffing runtime types.
 */
public interface RawResponse {

    enum Kind {
        TUPLE,
        BYTES,
        TEXT,
        MAPPING,
        SCALAR,
        UNKNOWN
    }

    Kind kind();

    /**
     * Short description for diagnostics, e.g. {@code tuple[2]} or {@code bytes[512]}.
     */
    String typeName();

    /**
     * Classify an arbitrary value returned by a terminal client.
     */
    static RawResponse of(Object value) {
        if (value instanceof RawResponse) {
            return (RawResponse) value;
        }
        if (value instanceof byte[]) {
            return new Bytes((byte[]) value);
        }
        if (value instanceof CharSequence) {
            return new Text(value.toString());
        }
        if (value instanceof Map) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                entries.put(String.valueOf(e.getKey()), e.getValue());
            }
            return new Mapping(entries);
        }
        if (value instanceof List) {
            return new Tuple(new ArrayList<>((List<?>) value));
        }
        if (value instanceof Object[]) {
            return new Tuple(Arrays.asList((Object[]) value));
        }
        if (value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum) {
            return new Scalar(value);
        }
        return new Unknown(value);
    }

    static RawResponse tuple(Object... elements) {
        return new Tuple(Arrays.asList(elements));
    }

    static RawResponse text(String text) {
        return new Text(text);
    }

    static RawResponse bytes(byte[] data) {
        return new Bytes(data);
    }

    /**
     * {@code (statusCode, payload)} style answer; elements may be null.
     */
    record Tuple(List<Object> elements) implements RawResponse {
        public Tuple {
            elements = elements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }

        @Override
        public String typeName() {
            return "tuple[" + elements.size() + "]";
        }
    }

    record Bytes(byte[] data) implements RawResponse {
        public Bytes {
            data = data == null ? new byte[0] : data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public Kind kind() {
            return Kind.BYTES;
        }

        @Override
        public String typeName() {
            return "bytes[" + data.length + "]";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes && Arrays.equals(data, ((Bytes) o).data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            int preview = Math.min(data.length, 64);
            return "Bytes[" + new String(data, 0, preview, StandardCharsets.UTF_8) + (data.length > preview ? "..." : "") + "]";
        }
    }

    record Text(String text) implements RawResponse {
        public Text {
            text = text == null ? "" : text;
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public String typeName() {
            return "text[" + text.length() + "]";
        }
    }

    record Mapping(Map<String, Object> entries) implements RawResponse {
        public Mapping {
            entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public Kind kind() {
            return Kind.MAPPING;
        }

        @Override
        public String typeName() {
            return "mapping{" + entries.size() + "}";
        }
    }

    record Scalar(Object value) implements RawResponse {
        @Override
        public Kind kind() {
            return Kind.SCALAR;
        }

        @Override
        public String typeName() {
            return "scalar:" + (value == null ? "null" : value.getClass().getSimpleName());
        }
    }

    record Unknown(Object value) implements RawResponse {
        @Override
        public Kind kind() {
            return Kind.UNKNOWN;
        }

        @Override
        public String typeName() {
            return value == null ? "null" : "unknown:" + value.getClass().getSimpleName();
        }
    }
}
