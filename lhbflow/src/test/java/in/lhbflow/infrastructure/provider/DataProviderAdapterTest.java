package in.lhbflow.infrastructure.provider;

import in.lhbflow.config.ProviderConfig;
import in.lhbflow.config.TerminalCredentials;
import in.lhbflow.domain.model.Query;
import in.lhbflow.domain.model.QueryKind;
import in.lhbflow.infrastructure.provider.common.BackoffPolicy;
import in.lhbflow.infrastructure.provider.common.RateLimiter;
import in.lhbflow.infrastructure.provider.common.Sleeper;
import in.lhbflow.infrastructure.provider.metrics.ProviderMetrics;
import in.lhbflow.infrastructure.provider.resolve.FallbackQueryResolver;
import in.lhbflow.infrastructure.provider.response.NormalizedRow;
import in.lhbflow.infrastructure.provider.response.ResponseNormalizer;
import in.lhbflow.infrastructure.provider.response.TabularFlattener;
import in.lhbflow.infrastructure.provider.session.SessionManager;
import in.lhbflow.infrastructure.terminal.RawResponse;
import in.lhbflow.infrastructure.terminal.TerminalException;
import in.lhbflow.infrastructure.terminal.TerminalOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for DataProviderAdapter against a scripted terminal.
 */
class DataProviderAdapterTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 2);
    private static final RawResponse EMPTY = RawResponse.tuple(0, List.of());

    private static final ProviderConfig CONFIG = new ProviderConfig(
        1000, Duration.ofSeconds(60), 2, Duration.ofMillis(1), Duration.ofMillis(1),
        Duration.ofMillis(200), Duration.ofSeconds(2), 2, Set.of(-1010));

    private final List<Duration> pauses = new ArrayList<>();

    private DataProviderAdapter adapter(ScriptedTerminal terminal) {
        return adapter(terminal, pauses::add);
    }

    private DataProviderAdapter adapter(ScriptedTerminal terminal, Sleeper sleeper) {
        SessionManager session = new SessionManager(terminal, new TerminalCredentials("user01", "secret", null),
            DataProviderAdapter.loginBackoff(CONFIG), d -> {}, ProviderMetrics.NOOP);
        FallbackQueryResolver resolver = new FallbackQueryResolver(terminal, session,
            new RateLimiter(CONFIG.maxRequestsPerWindow(), CONFIG.window()),
            new ResponseNormalizer(), CONFIG, ProviderMetrics.NOOP);
        return new DataProviderAdapter(resolver, new TabularFlattener(), session, CONFIG, sleeper);
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    private static RawResponse historyAnswer(String code, int points) {
        StringBuilder times = new StringBuilder();
        StringBuilder closes = new StringBuilder();
        for (int i = 0; i < points; i++) {
            if (i > 0) {
                times.append(',');
                closes.append(',');
            }
            times.append("\"2024-01-0").append(2 + i).append('"');
            closes.append(10 + i).append(".5");
        }
        String json = "{\"errorcode\":0,\"errmsg\":\"Success!\",\"tables\":[{\"thscode\":\"" + code
            + "\",\"table\":{\"time\":[" + times + "],\"close\":[" + closes + "]}}]}";
        return RawResponse.bytes(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Packed history answer for one code becomes one record per day")
    void testHistoryQuotesEndToEnd() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> historyAnswer(params.get(0), 5));
        Query query = Query.builder(QueryKind.HISTORY_QUOTES)
            .codes("000001.SZ")
            .between(DAY, LocalDate.of(2024, 1, 8))
            .indicators("close")
            .build();

        FetchResult result = adapter(terminal).fetchHistoryQuotes(query);

        assertEquals(FetchStatus.DATA, result.status());
        assertEquals(5, result.records().size());
        for (NormalizedRow record : result.records()) {
            assertFalse(record.hasArrayValues(), "Flattened record holds an array: " + record);
            assertEquals("000001.SZ", record.get("code"));
            assertEquals("000001.SZ", record.get("thscode"));
        }
        assertEquals("2024-01-02", result.records().get(0).get("time"));
        assertEquals(14.5, result.records().get(4).get("close"));
        assertEquals(List.of("000001.SZ", "close", "", "2024-01-02", "2024-01-08"), terminal.calls().get(0).params());
        assertEquals(1, terminal.logins());
    }

    @Test
    void testHistoryBatchesPauseAndReportFailedCodes() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> {
            switch (params.get(0)) {
                case "A.SZ":
                    return historyAnswer("A.SZ", 2);
                case "B.SZ":
                    return EMPTY;
                default:
                    throw new TerminalException(op, "timeout");
            }
        });
        Query query = Query.builder(QueryKind.HISTORY_QUOTES)
            .codes("A.SZ", "B.SZ", "C.SZ")
            .on(DAY)
            .build();

        FetchResult result = adapter(terminal).fetchHistoryQuotes(query);

        assertEquals(FetchStatus.DATA, result.status());
        assertEquals(2, result.records().size());
        assertEquals(List.of("C.SZ"), result.failedUnits(), "Empty code is no data, not a failure");
        assertEquals(List.of(Duration.ofMillis(200), Duration.ofSeconds(2)), pauses,
            "Inter-call pause inside the batch, inter-batch pause before the second batch");
        assertEquals(1 + 4 + 4, terminal.count(TerminalOperation.HISTORY_QUOTES));
    }

    @Test
    void testTradeFlowWholeMarketFirstCandidateWins() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> RawResponse.tuple(0, List.of(
            map("ths_stock_short_name_stock", "平安银行", "ths_stock_code_stock", "000001.SZ",
                "ths_lhb_buy_amount_stock", 1.2e8),
            map("ths_stock_short_name_stock", "浦发银行", "ths_stock_code_stock", "600000.SH",
                "ths_lhb_buy_amount_stock", 3.4e7))));
        Query query = Query.builder(QueryKind.TRADE_FLOW).allMarket().between(DAY, DAY.plusDays(1)).build();

        FetchResult result = adapter(terminal).fetchTradeFlow(query);

        assertEquals(FetchStatus.DATA, result.status());
        assertEquals(4, result.records().size());
        assertEquals(2, terminal.calls().size(), "One call per day");
        assertEquals("2024-01-03", result.records().get(3).get("trade_date"));
        assertEquals(List.of(Duration.ofMillis(200)), pauses);

        List<String> first = terminal.calls().get(0).params();
        assertEquals("block", first.get(0));
        assertEquals("2024-01-02", first.get(1));
        assertEquals("date:2024-01-02", first.get(2));
        assertTrue(first.get(3).startsWith("ths_stock_short_name_stock,ths_stock_code_stock,ths_lhb_buy_amount_stock"));
    }

    @Test
    void testTradeFlowFallsBackToBasicDataAndFiltersCodes() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> {
            if (op == TerminalOperation.BASIC_DATA && params.get(2).endsWith(",100")) {
                return RawResponse.tuple(0, List.of(
                    map("thscode", "000001.SZ", "ths_lhb_buy_amount_stock", 100),
                    map("thscode", "600000.SH", "ths_lhb_buy_amount_stock", 200)));
            }
            return EMPTY;
        });
        Query query = Query.builder(QueryKind.TRADE_FLOW).codes("000001.SZ").on(DAY).build();

        FetchResult result = adapter(terminal).fetchTradeFlow(query);

        assertEquals(FetchStatus.DATA, result.status());
        assertEquals(1, result.records().size());
        assertEquals("000001.SZ", result.records().get(0).get("thscode"));
        assertEquals(9, terminal.count(TerminalOperation.DATA_POOL));
        assertEquals(2, terminal.count(TerminalOperation.BASIC_DATA));
        assertEquals(11, result.trace().size());
    }

    @Test
    void testSeatDetailExpandsSeats() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> RawResponse.tuple(0, List.of(
            map("ths_stock_code_stock", "000001.SZ",
                "ths_lhb_seat_name_stock", "机构专用|华泰证券深圳益田路|中信证券上海溧阳路",
                "ths_lhb_seat_type_stock", "机构|游资|游资",
                "ths_lhb_buy_amount_seat_stock", "1000|500|0",
                "ths_lhb_sell_amount_seat_stock", "0|0|800"))));
        Query query = Query.builder(QueryKind.SEAT_DETAIL).allMarket().on(DAY).build();

        FetchResult result = adapter(terminal).fetchSeatDetail(query);

        assertEquals(3, result.records().size());
        NormalizedRow last = result.records().get(2);
        assertEquals("中信证券上海溧阳路", last.get("ths_lhb_seat_name_stock"));
        assertEquals("800", last.get("ths_lhb_sell_amount_seat_stock"));
        assertEquals("000001.SZ", last.get("ths_stock_code_stock"));
        assertEquals("2024-01-02", last.get("trade_date"));
    }

    @Test
    void testNothingAnywhereIsNoData() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> EMPTY);
        Query query = Query.builder(QueryKind.TRADE_FLOW).allMarket().on(DAY).build();

        FetchResult result = adapter(terminal).fetch(query);

        assertEquals(FetchStatus.NO_DATA, result.status());
        assertTrue(result.records().isEmpty());
        assertTrue(result.failedUnits().isEmpty());
        assertEquals(9, result.trace().size());
    }

    @Test
    void testFailingCallsAreTransient() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> {
            throw new TerminalException(op, "connection reset");
        });
        Query query = Query.builder(QueryKind.TRADE_FLOW).allMarket().on(DAY).build();

        FetchResult result = adapter(terminal).fetch(query);

        assertEquals(FetchStatus.TRANSIENT_FAILURE, result.status());
        assertEquals(List.of("2024-01-02"), result.failedUnits());
    }

    @Test
    @DisplayName("A day where every answer is a session-expired code is a failed unit, not an empty day")
    void testExpiredAnswersAreSessionUnavailable() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> RawResponse.tuple(-1010));
        Query query = Query.builder(QueryKind.TRADE_FLOW).allMarket().on(DAY).build();

        FetchResult result = adapter(terminal).fetch(query);

        assertEquals(FetchStatus.SESSION_UNAVAILABLE, result.status());
        assertEquals(List.of("2024-01-02"), result.failedUnits());
        assertEquals(9, terminal.logins(), "Each expired answer forces a fresh login");
    }

    @Test
    @DisplayName("A day where every answer carries an error code is a transient failure")
    void testErrorCodeAnswersAreTransient() {
        byte[] quota = "{\"errorcode\":-4001,\"errmsg\":\"quota exceeded\"}".getBytes(StandardCharsets.UTF_8);
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> RawResponse.bytes(quota));
        Query query = Query.builder(QueryKind.TRADE_FLOW).allMarket().on(DAY).build();

        FetchResult result = adapter(terminal).fetch(query);

        assertEquals(FetchStatus.TRANSIENT_FAILURE, result.status());
        assertEquals(List.of("2024-01-02"), result.failedUnits());
        assertTrue(result.records().isEmpty());
    }

    @Test
    void testRejectedLoginIsSessionUnavailable() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> EMPTY).loginCode(-2);
        Query query = Query.builder(QueryKind.HISTORY_QUOTES).codes("000001.SZ").on(DAY).build();

        FetchResult result = adapter(terminal).fetch(query);

        assertEquals(FetchStatus.SESSION_UNAVAILABLE, result.status());
        assertTrue(terminal.calls().isEmpty(), "No query without a session");
    }

    @Test
    void testInterruptedPauseCancels() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> EMPTY);
        Query query = Query.builder(QueryKind.TRADE_FLOW).allMarket().between(DAY, DAY.plusDays(2)).build();

        try {
            FetchResult result = adapter(terminal, d -> { throw new InterruptedException(); }).fetch(query);

            assertEquals(FetchStatus.CANCELLED, result.status());
            assertEquals(List.of("2024-01-03", "2024-01-04"), result.failedUnits());
            assertEquals(9, terminal.calls().size(), "Only the first day was resolved");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testInstrumentListMergesExchanges() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> {
            if (params.get(2).endsWith("exchange:SSE")) {
                return RawResponse.tuple(0, List.of(map("ths_stock_code_stock", List.of("600000.SH", "600036.SH"))));
            }
            return RawResponse.tuple(0, List.of(map("ths_stock_code_stock", List.of("000001.SZ", "600000.SH"))));
        });

        List<String> codes = adapter(terminal).listInstrumentCodes(DAY, Query.ALL_MARKET);

        assertEquals(List.of("600000.SH", "600036.SH", "000001.SZ"), codes);
        assertEquals("stock", terminal.calls().get(0).params().get(0));
        assertEquals(TerminalOperation.INSTRUMENT_LIST, terminal.calls().get(0).operation());
    }

    @Test
    void testWholeMarketHistoryUsesInstrumentList() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> {
            if (op == TerminalOperation.INSTRUMENT_LIST) {
                return params.get(2).endsWith("exchange:SSE")
                    ? RawResponse.tuple(0, List.of(map("ths_stock_code_stock", "600000.SH")))
                    : EMPTY;
            }
            return historyAnswer(params.get(0), 1);
        });
        Query query = Query.builder(QueryKind.HISTORY_QUOTES).allMarket().on(DAY).build();

        FetchResult result = adapter(terminal).fetch(query);

        assertEquals(FetchStatus.DATA, result.status());
        assertEquals(1, result.records().size());
        assertEquals("600000.SH", result.records().get(0).get("code"));
    }

    @Test
    void testWrongKindIsRejected() {
        ScriptedTerminal terminal = new ScriptedTerminal((op, params) -> EMPTY);
        Query query = Query.builder(QueryKind.SEAT_DETAIL).allMarket().on(DAY).build();

        assertThrows(IllegalArgumentException.class, () -> adapter(terminal).fetchTradeFlow(query));
        assertTrue(terminal.calls().isEmpty());
    }
}
