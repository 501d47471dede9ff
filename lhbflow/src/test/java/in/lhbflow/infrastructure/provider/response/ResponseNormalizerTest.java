package in.lhbflow.infrastructure.provider.response;

import in.lhbflow.infrastructure.terminal.RawResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResponseNormalizer.
 *
 * Tests:
 * - Tuple, bytes, text, mapping, scalar and unknown answers
 * - Charset fallback for non UTF-8 gateways
 * - Key padding across rows
 * - Degradation to an empty result on garbage
 */
class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    @Test
    void testTupleWithListOfMappings() {
        RawResponse raw = RawResponse.tuple(0, List.of(
            map("code", "000001.SZ", "close", 10.5),
            map("code", "600000.SH", "volume", 1200)));

        NormalizedResult result = normalizer.normalize(raw);

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals(2, result.rowCount());
        assertEquals(List.of("code", "close", "volume"), result.rows().get(0).fields(),
            "Rows are padded to the union of keys in first-seen order");
        assertTrue(result.rows().get(0).has("volume"));
        assertNull(result.rows().get(0).get("volume"));
        assertNull(result.rows().get(1).get("close"));
    }

    @Test
    void testListOfMappingsWithoutStatusKeepsEveryRow() {
        RawResponse raw = RawResponse.of(List.of(map("code", "A"), map("code", "B"), map("code", "C")));

        NormalizedResult result = normalizer.normalize(raw);

        assertEquals(RawResponse.Kind.TUPLE, raw.kind());
        assertEquals(OptionalInt.empty(), result.statusCode());
        assertEquals(3, result.rowCount(), "No record may be dropped from a plain list");
        assertEquals("A", result.rows().get(0).get("code"));
        assertEquals("C", result.rows().get(2).get("code"));
    }

    @Test
    void testTupleWithNullStatusStillReadsPayload() {
        NormalizedResult result = normalizer.normalize(RawResponse.tuple(null, List.of(map("code", "A"))));

        assertEquals(OptionalInt.empty(), result.statusCode());
        assertEquals(1, result.rowCount());
    }

    @Test
    void testTupleWithJsonTextPayload() {
        RawResponse raw = RawResponse.tuple("0", "[{\"code\":\"000001.SZ\"},{\"code\":\"000002.SZ\"}]");

        NormalizedResult result = normalizer.normalize(raw);

        assertEquals(OptionalInt.of(0), result.statusCode(), "Numeric string status is coerced");
        assertEquals(2, result.rowCount());
        assertEquals("000002.SZ", result.rows().get(1).get("code"));
    }

    @Test
    void testTupleWithScalarList() {
        NormalizedResult result = normalizer.normalize(RawResponse.tuple(0, List.of("000001.SZ", "600000.SH")));

        assertEquals(2, result.rowCount());
        assertEquals("600000.SH", result.rows().get(1).get(ResponseNormalizer.VALUE_FIELD));
    }

    @Test
    void testTupleWithErrorCodeAndNoPayload() {
        NormalizedResult result = normalizer.normalize(RawResponse.tuple(-1010));

        assertEquals(OptionalInt.of(-1010), result.statusCode());
        assertTrue(result.isEmpty());
    }

    @Test
    void testEmptyTuple() {
        NormalizedResult result = normalizer.normalize(RawResponse.tuple());

        assertTrue(result.statusCode().isEmpty());
        assertTrue(result.isEmpty());
    }

    @Test
    void testUtf8BytesWithGatewayEnvelope() {
        String json = "{\"errorcode\":0,\"errmsg\":\"Success!\",\"tables\":["
            + "{\"thscode\":\"000001.SZ\",\"table\":{\"close\":[10.1,10.2]}}]}";

        NormalizedResult result = normalizer.normalize(RawResponse.bytes(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals("Success!", result.message());
        assertEquals(1, result.rowCount());
        assertEquals("000001.SZ", result.rows().get(0).get("thscode"));
        assertTrue(result.rows().get(0).get("table") instanceof Map);
    }

    @Test
    void testGbkBytesAreDecoded() {
        String json = "{\"errorcode\":0,\"data\":[{\"name\":\"平安银行\"}]}";

        NormalizedResult result = normalizer.normalize(RawResponse.bytes(json.getBytes(Charset.forName("GBK"))));

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals("平安银行", result.rows().get(0).get("name"));
    }

    @Test
    void testBomIsStripped() {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "{\"code\":0,\"rows\":[{\"a\":1}]}".getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, data, 0, bom.length);
        System.arraycopy(body, 0, data, bom.length, body.length);

        NormalizedResult result = normalizer.normalize(RawResponse.bytes(data));

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals(1, result.rows().get(0).get("a"));
    }

    @Test
    void testTextArrayStartingWithIntegerIsATuple() {
        NormalizedResult result = normalizer.normalize(RawResponse.text("[0, [{\"a\": 1}, {\"a\": 2}]]"));

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals(2, result.rowCount());
    }

    @Test
    void testTextArrayOfObjectsHasNoStatus() {
        NormalizedResult result = normalizer.normalize(RawResponse.text("[{\"a\": 1}, {\"b\": 2}]"));

        assertTrue(result.statusCode().isEmpty());
        assertEquals(2, result.rowCount());
        assertEquals(List.of("a", "b"), result.rows().get(1).fields());
    }

    @Test
    void testMappingKeysAreCaseInsensitive() {
        RawResponse raw = RawResponse.of(map("ErrorCode", 0, "Data", List.of(map("x", 1))));

        NormalizedResult result = normalizer.normalize(raw);

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals(1, result.rowCount());
    }

    @Test
    void testMappingWithoutDataKeyBecomesOneRow() {
        RawResponse raw = RawResponse.of(map("code", 0, "msg", "ok", "close", 1.5, "open", 1.4));

        NormalizedResult result = normalizer.normalize(raw);

        assertEquals(OptionalInt.of(0), result.statusCode());
        assertEquals("ok", result.message());
        assertEquals(1, result.rowCount());
        assertEquals(List.of("close", "open"), result.rows().get(0).fields(),
            "Status and message keys are not data");
    }

    @Test
    void testNonNumericStatusAliasIsData() {
        RawResponse raw = RawResponse.of(map("code", "000001.SZ", "close", 1.5));

        NormalizedResult result = normalizer.normalize(raw);

        assertTrue(result.statusCode().isEmpty());
        assertEquals("000001.SZ", result.rows().get(0).get("code"));
    }

    @Test
    void testMappingWithOnlyStatus() {
        NormalizedResult result = normalizer.normalize(RawResponse.of(map("errorcode", -4001, "errmsg", "bad")));

        assertEquals(OptionalInt.of(-4001), result.statusCode());
        assertEquals("bad", result.message());
        assertTrue(result.isEmpty());
    }

    @Test
    void testScalar() {
        NormalizedResult result = normalizer.normalize(RawResponse.of(42));

        assertTrue(result.statusCode().isEmpty());
        assertEquals(42, result.rows().get(0).get(ResponseNormalizer.VALUE_FIELD));
    }

    @Test
    void testUnknownAndNullDegradeToEmpty() {
        assertEquals(NormalizedResult.empty(), normalizer.normalize(RawResponse.of(new Object())));
        assertEquals(NormalizedResult.empty(), normalizer.normalize(RawResponse.of(null)));
        assertEquals(NormalizedResult.empty(), normalizer.normalize(null));
    }

    @Test
    void testGarbageTextDegradesToEmpty() {
        assertTrue(normalizer.normalize(RawResponse.text("{not json")).isEmpty());
        assertTrue(normalizer.normalize(RawResponse.text("{} {}")).isEmpty(), "Trailing tokens are rejected");
        assertTrue(normalizer.normalize(RawResponse.text("   ")).isEmpty());
        assertTrue(normalizer.normalize(RawResponse.bytes(new byte[]{(byte) 0xFF, (byte) 0xFE, 0x00})).isEmpty());
    }

    @Test
    void testCustomAliasSets() {
        ResponseNormalizer custom = new ResponseNormalizer(List.of("rc"), List.of("payload"), List.of("why"));

        NormalizedResult result = custom.normalize(RawResponse.of(map("rc", 3, "why", "nope", "payload", List.of())));

        assertEquals(OptionalInt.of(3), result.statusCode());
        assertEquals("nope", result.message());
        assertTrue(result.isEmpty());
    }

    @Test
    void testEveryShapeNormalizesWithConsistentKeys() {
        List<RawResponse> shapes = List.of(
            RawResponse.tuple(0, List.of(map("a", 1), map("b", 2))),
            RawResponse.bytes("[{\"a\":1},{\"c\":3}]".getBytes(StandardCharsets.UTF_8)),
            RawResponse.text("{\"status\":0,\"items\":[{\"a\":1},{\"a\":2,\"d\":4}]}"),
            RawResponse.of(map("ret", 0, "list", List.of(map("x", null), map("y", 1)))),
            RawResponse.of(3.14),
            RawResponse.of(new Object()));

        for (RawResponse shape : shapes) {
            NormalizedResult result = assertDoesNotThrow(() -> normalizer.normalize(shape), shape.typeName());
            if (!result.isEmpty()) {
                List<String> fields = result.rows().get(0).fields();
                for (NormalizedRow row : result.rows()) {
                    assertEquals(fields, row.fields(), "Inconsistent keys for " + shape.typeName());
                }
            }
        }
    }
}
