package in.lhbflow.infrastructure.provider.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Undertow handler exposing a collector registry to Prometheus scrapers.
 *
 * Negotiates the exposition format from the {@code Accept} header (text 0.0.4 or OpenMetrics)
 * and honours {@code ?name[]=...} to scrape selected families only.
 *
 * <pre>
 * Handlers.routing().get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = new HashSet<>();
        Deque<String> requested = exchange.getQueryParameters().get("name[]");
        if (requested != null) {
            names.addAll(requested);
        }

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body,
                names.isEmpty() ? registry.metricFamilySamples() : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Scrape failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("metrics unavailable: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString());
        log.debug("[PrometheusMetricsHandler] Scraped {} chars as {}", body.getBuffer().length(), contentType);
    }
}
