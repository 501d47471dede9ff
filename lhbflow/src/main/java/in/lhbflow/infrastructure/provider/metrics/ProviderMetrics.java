package in.lhbflow.infrastructure.provider.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Provider metrics for monitoring the upstream terminal integration.
 *
 * Key metrics:
 * - Physical call outcomes and latency per operation
 * - Rate limiter waits
 * - Login attempts and session expiries
 * - Resolution outcomes per query kind
 */
public interface ProviderMetrics {

    /**
     * Record one physical call.
     *
     * @param operation Terminal operation name
     * @param outcome   SUCCESS, EMPTY, STATUS_ERROR, EXCEPTION or NO_SESSION
     * @param latency   Call latency (zero when the call was never made)
     */
    void recordAttempt(String operation, String outcome, Duration latency);

    /**
     * Record a caller blocked by the rate limiter.
     *
     * @param wait How long the caller is about to sleep
     */
    void recordRateLimitWait(Duration wait);

    /**
     * Record a login attempt.
     *
     * @param success Whether the session became usable
     * @param latency Login latency
     */
    void recordAuthentication(boolean success, Duration latency);

    /**
     * Record a session dropped because the terminal reported it as expired.
     */
    void recordSessionExpired();

    /**
     * Record the outcome of a full fallback resolution.
     *
     * @param kind     Query kind
     * @param outcome  Resolution outcome
     * @param attempts Number of candidates tried
     */
    void recordResolution(String kind, String outcome, int attempts);

    /**
     * Current counters, for logs and health output.
     */
    Map<String, Object> getMetrics();

    /**
     * Metrics sink that drops everything.
     */
    ProviderMetrics NOOP = new ProviderMetrics() {
        @Override
        public void recordAttempt(String operation, String outcome, Duration latency) {}

        @Override
        public void recordRateLimitWait(Duration wait) {}

        @Override
        public void recordAuthentication(boolean success, Duration latency) {}

        @Override
        public void recordSessionExpired() {}

        @Override
        public void recordResolution(String kind, String outcome, int attempts) {}

        @Override
        public Map<String, Object> getMetrics() {
            return Map.of();
        }
    };
}
