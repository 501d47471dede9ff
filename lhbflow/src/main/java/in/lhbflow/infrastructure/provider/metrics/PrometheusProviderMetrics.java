package in.lhbflow.infrastructure.provider.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus implementation of ProviderMetrics.
 *
 * Key Metrics:
 * - provider_attempts_total{operation, outcome} - Physical call outcomes
 * - provider_attempt_latency_seconds{operation} - Physical call latency
 * - provider_rate_limit_waits_total - Callers blocked by the rate limiter
 * - provider_rate_limit_wait_seconds - Time spent blocked
 * - provider_authentications_total{status} - Login attempts
 * - provider_session_status - 1 after a successful login, 0 after expiry
 * - provider_resolutions_total{kind, outcome} - Fallback resolution outcomes
 * - provider_resolution_attempts{kind} - Candidates tried per resolution
 */
public class PrometheusProviderMetrics implements ProviderMetrics {

    private final CollectorRegistry registry;

    private final Counter attemptCounter;
    private final Histogram attemptLatency;
    private final Counter rateLimitWaitCounter;
    private final Histogram rateLimitWaitSeconds;
    private final Counter authCounter;
    private final Histogram authLatency;
    private final Counter sessionExpiredCounter;
    private final Gauge sessionStatus;
    private final Counter resolutionCounter;
    private final Histogram resolutionAttempts;

    // In-memory totals for getMetrics()
    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong failedAttempts = new AtomicLong();
    private final AtomicLong rateLimitWaits = new AtomicLong();
    private final AtomicLong authFailures = new AtomicLong();
    private final AtomicLong sessionExpiries = new AtomicLong();
    private final AtomicLong resolutions = new AtomicLong();

    public PrometheusProviderMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusProviderMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.attemptCounter = Counter.build()
            .name("provider_attempts_total")
            .help("Total number of physical calls to the terminal")
            .labelNames("operation", "outcome")
            .register(registry);

        this.attemptLatency = Histogram.build()
            .name("provider_attempt_latency_seconds")
            .help("Physical call latency in seconds")
            .labelNames("operation")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.rateLimitWaitCounter = Counter.build()
            .name("provider_rate_limit_waits_total")
            .help("Total number of callers blocked by the rate limiter")
            .register(registry);

        this.rateLimitWaitSeconds = Histogram.build()
            .name("provider_rate_limit_wait_seconds")
            .help("Time spent blocked by the rate limiter in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 30.0, 60.0)
            .register(registry);

        this.authCounter = Counter.build()
            .name("provider_authentications_total")
            .help("Total number of login attempts")
            .labelNames("status")
            .register(registry);

        this.authLatency = Histogram.build()
            .name("provider_authentication_latency_seconds")
            .help("Login latency in seconds")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.sessionExpiredCounter = Counter.build()
            .name("provider_session_expired_total")
            .help("Total number of sessions dropped after an expiry code")
            .register(registry);

        this.sessionStatus = Gauge.build()
            .name("provider_session_status")
            .help("Current session status (1=logged in, 0=logged out)")
            .register(registry);

        this.resolutionCounter = Counter.build()
            .name("provider_resolutions_total")
            .help("Total number of fallback resolutions")
            .labelNames("kind", "outcome")
            .register(registry);

        this.resolutionAttempts = Histogram.build()
            .name("provider_resolution_attempts")
            .help("Candidates tried per resolution")
            .labelNames("kind")
            .buckets(1, 2, 3, 5, 10, 20)
            .register(registry);
    }

    @Override
    public void recordAttempt(String operation, String outcome, Duration latency) {
        attemptCounter.labels(operation, outcome).inc();
        attemptLatency.labels(operation).observe(latency.toMillis() / 1000.0);
        totalAttempts.incrementAndGet();
        if (!"SUCCESS".equals(outcome)) {
            failedAttempts.incrementAndGet();
        }
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
        rateLimitWaitCounter.inc();
        rateLimitWaitSeconds.observe(wait.toMillis() / 1000.0);
        rateLimitWaits.incrementAndGet();
    }

    @Override
    public void recordAuthentication(boolean success, Duration latency) {
        authCounter.labels(success ? "success" : "failure").inc();
        authLatency.observe(latency.toMillis() / 1000.0);
        if (success) {
            sessionStatus.set(1);
        } else {
            authFailures.incrementAndGet();
        }
    }

    @Override
    public void recordSessionExpired() {
        sessionExpiredCounter.inc();
        sessionStatus.set(0);
        sessionExpiries.incrementAndGet();
    }

    @Override
    public void recordResolution(String kind, String outcome, int attempts) {
        resolutionCounter.labels(kind, outcome).inc();
        resolutionAttempts.labels(kind).observe(attempts);
        resolutions.incrementAndGet();
    }

    @Override
    public Map<String, Object> getMetrics() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalAttempts", totalAttempts.get());
        map.put("failedAttempts", failedAttempts.get());
        map.put("rateLimitWaits", rateLimitWaits.get());
        map.put("authenticationFailures", authFailures.get());
        map.put("sessionExpiries", sessionExpiries.get());
        map.put("resolutions", resolutions.get());
        return map;
    }

    /**
     * Get Prometheus registry for HTTP exposure.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
