package in.lhbflow.bootstrap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.lhbflow.config.ProviderConfig;
import in.lhbflow.config.TerminalCredentials;
import in.lhbflow.domain.model.Query;
import in.lhbflow.domain.model.QueryKind;
import in.lhbflow.infrastructure.provider.DataProviderAdapter;
import in.lhbflow.infrastructure.provider.FetchResult;
import in.lhbflow.infrastructure.provider.metrics.PrometheusMetricsHandler;
import in.lhbflow.infrastructure.provider.metrics.PrometheusProviderMetrics;
import in.lhbflow.infrastructure.provider.response.NormalizedRow;
import in.lhbflow.infrastructure.provider.session.SessionManager;
import in.lhbflow.infrastructure.terminal.HttpTerminalClient;
import in.lhbflow.transform.RecordTransformer;
import in.lhbflow.transform.TargetTable;
import in.lhbflow.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point: one fetch, records printed as JSON lines.
 *
 * <pre>
 * IngestApp KIND START [END] [CODES]
 *   KIND   TRADE_FLOW | SEAT_DETAIL | HISTORY_QUOTES | INSTRUMENT_LIST
 *   START  yyyy-MM-dd
 *   END    yyyy-MM-dd, defaults to START
 *   CODES  comma separated, defaults to * (whole market)
 * </pre>
 *
 * Exit codes: 0 data or no data, 1 bad arguments, 2 fetch failed.
 */
public final class IngestApp {
    private static final Logger log = LoggerFactory.getLogger(IngestApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IngestApp() {}

    public static void main(String[] args) {
        Query query;
        try {
            query = parseQuery(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: IngestApp KIND START [END] [CODES]");
            System.exit(1);
            return;
        }

        log.info("=== lhbflow ingest: {} {}..{} ({} codes) ===",
            query.kind(), query.startDate(), query.endDate(), query.codes().size());

        ProviderConfig config = ProviderConfig.fromEnv();
        TerminalCredentials credentials = TerminalCredentials.fromEnv();
        log.info("Config: {}", config);
        log.info("Terminal: {}", credentials);

        PrometheusProviderMetrics metrics = new PrometheusProviderMetrics();
        Undertow metricsServer = startMetricsServer(Env.getInt("METRICS_PORT", 0), metrics);

        HttpTerminalClient terminal = new HttpTerminalClient(credentials.baseUrl());
        DataProviderAdapter adapter = new DataProviderAdapter(terminal, credentials, config, metrics);
        SessionManager session = adapter.getSessionManager();
        Runtime.getRuntime().addShutdownHook(new Thread(session::close, "lhbflow-logout"));

        int exitCode;
        try {
            FetchResult result = adapter.fetch(query);
            exitCode = report(result, System.out);
            log.info("Metrics: {}", metrics.getMetrics());
        } finally {
            session.close();
            if (metricsServer != null) {
                metricsServer.stop();
            }
        }
        System.exit(exitCode);
    }

    static Query parseQuery(String[] args) {
        if (args == null || args.length < 2) {
            throw new IllegalArgumentException("Expected at least KIND and START, got " + Arrays.toString(args));
        }
        QueryKind kind;
        try {
            kind = QueryKind.valueOf(args[0].trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown kind '" + args[0] + "', expected one of "
                + Arrays.toString(QueryKind.values()));
        }
        LocalDate start = parseDate(args[1]);
        LocalDate end = args.length > 2 ? parseDate(args[2]) : start;
        List<String> codes = args.length > 3
            ? Arrays.asList(args[3].split(","))
            : List.of(Query.ALL_MARKET);

        return Query.builder(kind).codes(codes).between(start, end).build();
    }

    static TargetTable targetTableFor(QueryKind kind) {
        return switch (kind) {
            case TRADE_FLOW -> TargetTable.TRADE_FLOW;
            case SEAT_DETAIL -> TargetTable.SEAT_DAILY;
            case HISTORY_QUOTES -> TargetTable.DAILY_QUOTES;
            case INSTRUMENT_LIST -> null;
        };
    }

    /**
     * Print records as JSON lines and map the status to an exit code.
     */
    static int report(FetchResult result, PrintStream out) {
        if (!result.failedUnits().isEmpty()) {
            log.warn("Failed units: {}", result.failedUnits());
        }
        if (!result.hasData()) {
            log.info("Fetch finished with {} after {} attempts", result.status(), result.trace().size());
            if (log.isDebugEnabled()) {
                result.trace().forEach(t -> log.debug("  {}", t));
            }
            return result.status().isFailure() ? 2 : 0;
        }

        List<NormalizedRow> rows = result.records();
        TargetTable table = targetTableFor(result.query().kind());
        if (table != null) {
            RecordTransformer.TransformResult transformed = new RecordTransformer().transform(rows, table);
            rows = transformed.rows();
        }
        for (NormalizedRow row : rows) {
            try {
                out.println(MAPPER.writeValueAsString(row.asMap()));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize row {}: {}", row, e.getMessage());
            }
        }
        log.info("Wrote {} rows", rows.size());
        return 0;
    }

    private static Undertow startMetricsServer(int port, PrometheusProviderMetrics metrics) {
        if (port <= 0) {
            return null;
        }
        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(Handlers.routing().get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();
        log.info("✓ Prometheus /metrics endpoint on port {}", port);
        return server;
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + text + "', expected yyyy-MM-dd");
        }
    }
}
