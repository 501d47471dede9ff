package in.lhbflow.infrastructure.provider.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.lhbflow.infrastructure.terminal.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns any {@link RawResponse} into a {@link NormalizedResult}.
 *
 * <p>Total: every input maps to a result and nothing is thrown. Unparseable or unrecognized
 * input degrades to an empty result with no status code.
 *
 * <p>A tuple is {@code (status, payload[, message])} when its first element is a status code
 * (or null); any other sequence, such as a list of record mappings, is read as rows.
 *
 * <p>Mapping answers are searched case-insensitively for a status key, a data key and a
 * message key. Each alias list is tried in order and the first key present wins. All rows of one
 * result share the same field set; fields a row lacks are present with a null value.
 */
public class ResponseNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    public static final List<String> DEFAULT_STATUS_KEYS =
        List.of("errorcode", "error_code", "errcode", "code", "return", "ret", "status");
    public static final List<String> DEFAULT_DATA_KEYS =
        List.of("data", "tables", "table", "rows", "list", "result", "items", "records");
    public static final List<String> DEFAULT_MESSAGE_KEYS =
        List.of("errmsg", "message", "msg", "error_msg");

    /** Field name used when the payload is a bare scalar. */
    public static final String VALUE_FIELD = "value";

    private static final List<Charset> CHARSETS = List.of(
        StandardCharsets.UTF_8,
        Charset.forName("GB18030"),
        Charset.forName("GBK"),
        Charset.forName("Big5"));

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,10}");

    private final ObjectMapper mapper;
    private final List<String> statusKeys;
    private final List<String> dataKeys;
    private final List<String> messageKeys;

    public ResponseNormalizer() {
        this(DEFAULT_STATUS_KEYS, DEFAULT_DATA_KEYS, DEFAULT_MESSAGE_KEYS);
    }

    public ResponseNormalizer(List<String> statusKeys, List<String> dataKeys, List<String> messageKeys) {
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.statusKeys = lowerCase(statusKeys);
        this.dataKeys = lowerCase(dataKeys);
        this.messageKeys = lowerCase(messageKeys);
    }

    public NormalizedResult normalize(RawResponse raw) {
        if (raw == null) {
            return NormalizedResult.empty();
        }
        try {
            NormalizedResult result = dispatch(raw);
            return new NormalizedResult(result.statusCode(), result.message(), padRows(result.rows()));
        } catch (RuntimeException e) {
            log.warn("[ResponseNormalizer] Failed to normalize {}: {}", raw.typeName(), e.getMessage());
            return NormalizedResult.empty();
        }
    }

    private NormalizedResult dispatch(RawResponse raw) {
        return switch (raw.kind()) {
            case TUPLE -> fromTuple(((RawResponse.Tuple) raw).elements());
            case BYTES -> fromText(decode(((RawResponse.Bytes) raw).data()));
            case TEXT -> fromText(((RawResponse.Text) raw).text());
            case MAPPING -> fromMapping(((RawResponse.Mapping) raw).entries());
            case SCALAR -> fromScalar(((RawResponse.Scalar) raw).value());
            case UNKNOWN -> {
                log.debug("[ResponseNormalizer] Unrecognized response {}", raw.typeName());
                yield NormalizedResult.empty();
            }
        };
    }

    private NormalizedResult fromTuple(List<Object> elements) {
        if (elements.isEmpty()) {
            return NormalizedResult.empty();
        }
        Object head = elements.get(0);
        OptionalInt status = toStatusCode(head);
        if (status.isEmpty() && head != null) {
            // no leading status: a plain sequence of records
            return new NormalizedResult(OptionalInt.empty(), null, listRows(elements));
        }
        List<NormalizedRow> rows = elements.size() > 1 ? payloadRows(elements.get(1)) : List.of();
        String message = null;
        if (elements.size() > 2 && elements.get(2) instanceof CharSequence) {
            message = elements.get(2).toString();
        }
        return new NormalizedResult(status, message, rows);
    }

    private NormalizedResult fromText(String text) {
        String json = stripBom(text).trim();
        if (json.isEmpty()) {
            return NormalizedResult.empty();
        }
        Object parsed;
        try {
            parsed = mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("[ResponseNormalizer] Text is not JSON: {}", e.getOriginalMessage());
            return NormalizedResult.empty();
        }
        return fromJson(parsed);
    }

    private NormalizedResult fromJson(Object parsed) {
        if (parsed instanceof Map) {
            return fromMapping(stringKeys((Map<?, ?>) parsed));
        }
        if (parsed instanceof List) {
            List<?> list = (List<?>) parsed;
            if (!list.isEmpty() && isIntegral(list.get(0))) {
                return fromTuple(new ArrayList<>(list));
            }
            return new NormalizedResult(OptionalInt.empty(), null, listRows(list));
        }
        return fromScalar(parsed);
    }

    private NormalizedResult fromMapping(Map<String, Object> entries) {
        Map<String, String> byLowerCase = new LinkedHashMap<>();
        for (String key : entries.keySet()) {
            byLowerCase.putIfAbsent(key.toLowerCase(Locale.ROOT), key);
        }

        OptionalInt status = OptionalInt.empty();
        String statusKey = findKey(byLowerCase, statusKeys);
        if (statusKey != null) {
            status = toStatusCode(entries.get(statusKey));
            if (status.isEmpty()) {
                statusKey = null;
            }
        }

        String message = null;
        String messageKey = findKey(byLowerCase, messageKeys);
        if (messageKey != null && entries.get(messageKey) != null) {
            message = String.valueOf(entries.get(messageKey));
        }

        String dataKey = findKey(byLowerCase, dataKeys);
        if (dataKey != null) {
            return new NormalizedResult(status, message, payloadRows(entries.get(dataKey)));
        }

        Map<String, Object> remaining = new LinkedHashMap<>(entries);
        if (statusKey != null) {
            remaining.remove(statusKey);
        }
        if (messageKey != null) {
            remaining.remove(messageKey);
        }
        List<NormalizedRow> rows = remaining.isEmpty() ? List.of() : List.of(NormalizedRow.of(remaining));
        return new NormalizedResult(status, message, rows);
    }

    private NormalizedResult fromScalar(Object value) {
        if (value == null) {
            return NormalizedResult.empty();
        }
        return new NormalizedResult(OptionalInt.empty(), null, List.of(scalarRow(value)));
    }

    /**
     * Rows carried by the payload slot of a tuple or the data key of a mapping.
     */
    private List<NormalizedRow> payloadRows(Object payload) {
        if (payload == null) {
            return List.of();
        }
        if (payload instanceof byte[]) {
            return parsedPayloadRows(decode((byte[]) payload));
        }
        if (payload instanceof CharSequence) {
            return parsedPayloadRows(payload.toString());
        }
        if (payload instanceof Map) {
            return List.of(NormalizedRow.of(stringKeys((Map<?, ?>) payload)));
        }
        List<Object> list = NormalizedRow.asList(payload);
        if (list != null) {
            return listRows(list);
        }
        return List.of(scalarRow(payload));
    }

    private List<NormalizedRow> parsedPayloadRows(String text) {
        String json = stripBom(text).trim();
        if (json.isEmpty()) {
            return List.of();
        }
        Object parsed;
        try {
            parsed = mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            // plain string payload
            return List.of(scalarRow(text));
        }
        if (parsed instanceof Map) {
            return fromMapping(stringKeys((Map<?, ?>) parsed)).rows();
        }
        if (parsed instanceof List) {
            return listRows((List<?>) parsed);
        }
        return parsed == null ? List.of() : List.of(scalarRow(parsed));
    }

    private List<NormalizedRow> listRows(List<?> list) {
        List<NormalizedRow> rows = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof Map) {
                rows.add(NormalizedRow.of(stringKeys((Map<?, ?>) element)));
            } else {
                rows.add(scalarRow(element));
            }
        }
        return rows;
    }

    private static NormalizedRow scalarRow(Object value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(VALUE_FIELD, value);
        return NormalizedRow.of(row);
    }

    private static List<NormalizedRow> padRows(List<NormalizedRow> rows) {
        if (rows.size() < 2) {
            return rows;
        }
        Set<String> union = new LinkedHashSet<>();
        for (NormalizedRow row : rows) {
            union.addAll(row.fields());
        }
        List<NormalizedRow> padded = new ArrayList<>(rows.size());
        for (NormalizedRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String field : union) {
                values.put(field, row.get(field));
            }
            padded.add(NormalizedRow.of(values));
        }
        return padded;
    }

    /**
     * Decode bytes trying each charset strictly; lossy UTF-8 when none fits.
     */
    static String decode(byte[] data) {
        for (Charset charset : CHARSETS) {
            try {
                return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
            } catch (CharacterCodingException e) {
                log.trace("[ResponseNormalizer] Payload is not {}", charset.name());
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE)
                .decode(ByteBuffer.wrap(data))
                .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalStateException("Lossy UTF-8 decoding failed", e);
        }
    }

    static OptionalInt toStatusCode(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long v = ((Number) value).longValue();
            return fitsInt(v) ? OptionalInt.of((int) v) : OptionalInt.empty();
        }
        if (value instanceof BigInteger) {
            BigInteger v = (BigInteger) value;
            return v.bitLength() < 32 ? OptionalInt.of(v.intValue()) : OptionalInt.empty();
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && fitsInt((long) d)) {
                return OptionalInt.of((int) d);
            }
            return OptionalInt.empty();
        }
        if (value instanceof CharSequence) {
            String s = value.toString().trim();
            if (INTEGER.matcher(s).matches()) {
                long v = Long.parseLong(s.startsWith("+") ? s.substring(1) : s);
                return fitsInt(v) ? OptionalInt.of((int) v) : OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof BigInteger
            || value instanceof Short || value instanceof Byte;
    }

    private static boolean fitsInt(long v) {
        return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE;
    }

    private static String findKey(Map<String, String> byLowerCase, List<String> aliases) {
        for (String alias : aliases) {
            String key = byLowerCase.get(alias);
            if (key != null) {
                return key;
            }
        }
        return null;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private static List<String> lowerCase(List<String> keys) {
        List<String> out = new ArrayList<>(keys.size());
        for (String key : keys) {
            out.add(key.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(out);
    }
}
