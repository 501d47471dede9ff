package in.lhbflow.infrastructure.provider;

import in.lhbflow.config.ProviderConfig;
import in.lhbflow.config.TerminalCredentials;
import in.lhbflow.domain.model.Query;
import in.lhbflow.domain.model.QueryKind;
import in.lhbflow.infrastructure.provider.common.BackoffPolicy;
import in.lhbflow.infrastructure.provider.common.RateLimiter;
import in.lhbflow.infrastructure.provider.common.Sleeper;
import in.lhbflow.infrastructure.provider.metrics.ProviderMetrics;
import in.lhbflow.infrastructure.provider.resolve.AttemptTrace;
import in.lhbflow.infrastructure.provider.resolve.CandidateShapes;
import in.lhbflow.infrastructure.provider.resolve.CandidateShapes.FilterVariant;
import in.lhbflow.infrastructure.provider.resolve.FallbackQueryResolver;
import in.lhbflow.infrastructure.provider.resolve.InvocationShape;
import in.lhbflow.infrastructure.provider.resolve.Resolution;
import in.lhbflow.infrastructure.provider.response.NormalizedRow;
import in.lhbflow.infrastructure.provider.response.ResponseNormalizer;
import in.lhbflow.infrastructure.provider.response.TabularFlattener;
import in.lhbflow.infrastructure.provider.session.SessionManager;
import in.lhbflow.infrastructure.terminal.TerminalClient;
import in.lhbflow.infrastructure.terminal.TerminalOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for fetching dragon-tiger list and quote data from the terminal.
 *
 * <p>Every fetch is split into units (one calendar day, one code or one market). Each unit is
 * resolved through the fallback resolver; the unit results are then merged into one
 * {@link FetchResult}. Callers never see exceptions from the terminal, only statuses.
 *
 * <p>All calls block: rate limiting, login backoff and pauses between units can take seconds.
 * Interrupting the calling thread stops the fetch with {@link FetchStatus#CANCELLED}.
 */
public class DataProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(DataProviderAdapter.class);

    static final String TRADE_FLOW_REPORT = "block";
    static final String INSTRUMENT_REPORT = "stock";
    static final List<String> STOCK_ID_FIELDS = List.of("ths_stock_short_name_stock", "ths_stock_code_stock");
    static final List<String> CODE_FIELDS = List.of("ths_stock_code_stock", "thscode", "code", "stock_code");
    static final String SEAT_DELIMITER = "|";

    private final FallbackQueryResolver resolver;
    private final TabularFlattener flattener;
    private final SessionManager sessionManager;
    private final ProviderConfig config;
    private final Sleeper sleeper;

    public DataProviderAdapter(FallbackQueryResolver resolver, TabularFlattener flattener,
                               SessionManager sessionManager, ProviderConfig config, Sleeper sleeper) {
        this.resolver = resolver;
        this.flattener = flattener;
        this.sessionManager = sessionManager;
        this.config = config;
        this.sleeper = sleeper;
    }

    /**
     * Wire the whole stack against one terminal client.
     */
    public DataProviderAdapter(TerminalClient terminal, TerminalCredentials credentials,
                               ProviderConfig config, ProviderMetrics metrics) {
        this(terminal, new SessionManager(terminal, credentials, loginBackoff(config), Sleeper.SYSTEM, metrics),
            config, metrics);
    }

    private DataProviderAdapter(TerminalClient terminal, SessionManager sessionManager,
                                ProviderConfig config, ProviderMetrics metrics) {
        this(new FallbackQueryResolver(terminal, sessionManager,
                new RateLimiter(config.maxRequestsPerWindow(), config.window(), metrics),
                new ResponseNormalizer(), config, metrics),
            new TabularFlattener(), sessionManager, config, Sleeper.SYSTEM);
    }

    static BackoffPolicy loginBackoff(ProviderConfig config) {
        return BackoffPolicy.builder()
            .initialDelay(config.baseRetryDelay())
            .maxDelay(config.maxRetryDelay())
            .multiplier(2.0)
            .maxAttempts(config.loginMaxRetries())
            .build();
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    /**
     * Dispatch on the query kind.
     */
    public FetchResult fetch(Query query) {
        return switch (query.kind()) {
            case TRADE_FLOW -> fetchTradeFlow(query);
            case SEAT_DETAIL -> fetchSeatDetail(query);
            case HISTORY_QUOTES -> fetchHistoryQuotes(query);
            case INSTRUMENT_LIST -> fetchInstrumentList(query);
        };
    }

    /**
     * Per-stock dragon-tiger totals, one resolution per calendar day.
     */
    public FetchResult fetchTradeFlow(Query query) {
        requireKind(query, QueryKind.TRADE_FLOW);
        return fetchDaily(query, false);
    }

    /**
     * Per-seat dragon-tiger detail, one record per seat.
     */
    public FetchResult fetchSeatDetail(Query query) {
        requireKind(query, QueryKind.SEAT_DETAIL);
        return fetchDaily(query, true);
    }

    /**
     * Daily quotes per code. Codes are processed in batches with pauses in between;
     * {@link Query#ALL_MARKET} expands to the instrument list as of the end date.
     */
    public FetchResult fetchHistoryQuotes(Query query) {
        requireKind(query, QueryKind.HISTORY_QUOTES);
        UnitAccumulator acc = new UnitAccumulator(query);

        List<String> codes = query.codes();
        if (query.isAllMarket()) {
            codes = listInstrumentCodes(query.endDate(), Query.ALL_MARKET);
            if (codes.isEmpty()) {
                log.warn("[DataProviderAdapter] No instruments listed on {}, nothing to fetch", query.endDate());
                return acc.build();
            }
        }

        int batchSize = config.historyBatchSize();
        int batches = (codes.size() + batchSize - 1) / batchSize;
        for (int b = 0; b < batches; b++) {
            if (b > 0 && !pause(config.interBatchDelay())) {
                acc.cancelled(codes.subList(b * batchSize, codes.size()));
                break;
            }
            List<String> batch = codes.subList(b * batchSize, Math.min(codes.size(), (b + 1) * batchSize));
            log.info("[DataProviderAdapter] History batch {}/{} ({} codes)", b + 1, batches, batch.size());

            boolean cancelled = false;
            for (int i = 0; i < batch.size(); i++) {
                String code = batch.get(i);
                if (i > 0 && !pause(config.interCallDelay())) {
                    cancelled = true;
                }
                if (cancelled || Thread.currentThread().isInterrupted()) {
                    acc.cancelled(codes.subList(b * batchSize + i, codes.size()));
                    cancelled = true;
                    break;
                }

                List<InvocationShape> candidates = CandidateShapes.historyQuotes(
                    code, query.joinedIndicators(), query.startDate(), query.endDate());
                Resolution resolution = resolver.resolve(query, candidates);

                List<NormalizedRow> records = new ArrayList<>();
                for (NormalizedRow row : flattener.flattenAll(resolution.rows())) {
                    records.add(row.has("code") ? row : row.with("code", code));
                }
                acc.add(code, resolution, records);
            }
            if (cancelled) {
                break;
            }
        }
        return acc.build();
    }

    /**
     * Instrument codes of one market scope ({@code *}, {@code SSE} or {@code SZSE}).
     * {@code *} is fetched per exchange and merged.
     */
    public FetchResult fetchInstrumentList(Query query) {
        requireKind(query, QueryKind.INSTRUMENT_LIST);
        UnitAccumulator acc = new UnitAccumulator(query);
        LocalDate date = query.endDate();

        Set<FilterVariant> markets = new LinkedHashSet<>();
        for (String code : query.codes()) {
            if (Query.ALL_MARKET.equals(code)) {
                markets.add(FilterVariant.SSE);
                markets.add(FilterVariant.SZSE);
            } else {
                markets.add(FilterVariant.forMarket(code));
            }
        }

        boolean first = true;
        for (FilterVariant market : markets) {
            if (!first && !pause(config.interCallDelay())) {
                acc.cancelled(List.of(market.name()));
                break;
            }
            first = false;
            List<InvocationShape> candidates = CandidateShapes.dataPool(TerminalOperation.INSTRUMENT_LIST,
                INSTRUMENT_REPORT, date, query.joinedIndicators(), List.of(market));
            Resolution resolution = resolver.resolve(query, candidates);
            acc.add(market.name(), resolution, flattener.flattenAll(resolution.rows()));
        }
        return acc.build();
    }

    /**
     * Distinct instrument codes listed on {@code date}; empty when none could be fetched.
     */
    public List<String> listInstrumentCodes(LocalDate date, String market) {
        Query query = Query.builder(QueryKind.INSTRUMENT_LIST).codes(market).on(date).build();
        FetchResult result = fetchInstrumentList(query);
        if (!result.hasData()) {
            log.warn("[DataProviderAdapter] Instrument list for {} on {}: {}", market, date, result.status());
            return List.of();
        }
        Set<String> codes = new LinkedHashSet<>();
        for (NormalizedRow row : result.records()) {
            String code = codeOf(row);
            if (code == null && row.get(ResponseNormalizer.VALUE_FIELD) != null) {
                code = String.valueOf(row.get(ResponseNormalizer.VALUE_FIELD));
            }
            if (code != null && !code.isBlank()) {
                codes.add(code.trim());
            }
        }
        return List.copyOf(codes);
    }

    private FetchResult fetchDaily(Query query, boolean expandSeats) {
        UnitAccumulator acc = new UnitAccumulator(query);
        List<String> fieldList = new ArrayList<>(STOCK_ID_FIELDS);
        for (String indicator : query.indicators()) {
            if (!fieldList.contains(indicator)) {
                fieldList.add(indicator);
            }
        }
        String fields = String.join(",", fieldList);
        Set<String> wanted = query.isAllMarket() ? Set.of() : new HashSet<>(query.codes());

        List<LocalDate> days = query.days();
        for (int i = 0; i < days.size(); i++) {
            LocalDate day = days.get(i);
            if ((i > 0 && !pause(config.interCallDelay())) || Thread.currentThread().isInterrupted()) {
                List<String> rest = new ArrayList<>();
                for (LocalDate d : days.subList(i, days.size())) {
                    rest.add(d.toString());
                }
                acc.cancelled(rest);
                break;
            }

            List<InvocationShape> candidates = new ArrayList<>(
                CandidateShapes.dataPool(TerminalOperation.DATA_POOL, TRADE_FLOW_REPORT, day, fields));
            if (!query.isAllMarket()) {
                candidates.addAll(CandidateShapes.basicData(query.joinedCodes(), query.joinedIndicators(), day));
            }
            Resolution resolution = resolver.resolve(query, candidates);

            List<NormalizedRow> records = new ArrayList<>();
            for (NormalizedRow row : flattener.flattenAll(resolution.rows())) {
                List<NormalizedRow> expanded = expandSeats
                    ? flattener.expandDelimited(row, query.indicators(), SEAT_DELIMITER)
                    : List.of(row);
                for (NormalizedRow record : expanded) {
                    String code = codeOf(record);
                    if (!wanted.isEmpty() && code != null && !wanted.contains(code)) {
                        continue;
                    }
                    records.add(record.with("trade_date", day.toString()));
                }
            }
            acc.add(day.toString(), resolution, records);
        }
        return acc.build();
    }

    /**
     * Sleep between units.
     *
     * @return false when interrupted (flag restored)
     */
    private boolean pause(Duration delay) {
        if (delay.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String codeOf(NormalizedRow row) {
        for (String field : CODE_FIELDS) {
            Object value = row.get(field);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private static void requireKind(Query query, QueryKind expected) {
        if (query.kind() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " query, got " + query.kind());
        }
    }

    /**
     * Collects per-unit results and applies the aggregation rule.
     */
    private static final class UnitAccumulator {
        private final Query query;
        private final List<NormalizedRow> records = new ArrayList<>();
        private final List<AttemptTrace> trace = new ArrayList<>();
        private final List<FetchStatus> statuses = new ArrayList<>();
        private final List<String> failedUnits = new ArrayList<>();

        UnitAccumulator(Query query) {
            this.query = query;
        }

        void add(String unit, Resolution resolution, List<NormalizedRow> unitRecords) {
            trace.addAll(resolution.trace());
            FetchStatus status = switch (resolution.outcome()) {
                case SUCCESS -> unitRecords.isEmpty() ? FetchStatus.NO_DATA : FetchStatus.DATA;
                case EXHAUSTED -> FetchStatus.NO_DATA;
                case UNAVAILABLE -> FetchStatus.TRANSIENT_FAILURE;
                case SESSION_LOST -> FetchStatus.SESSION_UNAVAILABLE;
                case CANCELLED -> FetchStatus.CANCELLED;
            };
            statuses.add(status);
            if (status == FetchStatus.DATA) {
                records.addAll(unitRecords);
            } else if (status.isFailure()) {
                failedUnits.add(unit);
            }
            log.debug("[DataProviderAdapter] {} {}: {} ({} records, {} attempts)",
                query.kind(), unit, status, unitRecords.size(), resolution.attempts());
        }

        void cancelled(List<String> units) {
            statuses.add(FetchStatus.CANCELLED);
            failedUnits.addAll(units);
        }

        FetchResult build() {
            FetchStatus status = FetchStatus.aggregate(statuses);
            if (status != FetchStatus.DATA) {
                records.clear();
            }
            log.info("[DataProviderAdapter] {} {}..{}: {} with {} records, {} attempts, {} failed units",
                query.kind(), query.startDate(), query.endDate(), status, records.size(), trace.size(),
                failedUnits.size());
            return new FetchResult(query, status, records, trace, failedUnits);
        }
    }
}
