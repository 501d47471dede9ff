package in.lhbflow.config;

import in.lhbflow.util.Env;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Tuning knobs for the data provider adapter.
 *
 * All values are plain numbers with defaults matching the upstream account quota
 * (30 calls per rolling minute).
 */
public record ProviderConfig(
    int maxRequestsPerWindow,       // calls allowed inside one sliding window
    Duration window,                // sliding window length
    int loginMaxRetries,            // login attempts before EnsureActive gives up
    Duration baseRetryDelay,        // first backoff delay, doubled on every further attempt
    Duration maxRetryDelay,         // backoff cap
    Duration interCallDelay,        // pause between two physical calls of one fetch
    Duration interBatchDelay,       // pause between two code batches of a history fetch
    int historyBatchSize,           // codes per history batch
    Set<Integer> sessionExpiredCodes
) {

    public ProviderConfig {
        if (maxRequestsPerWindow <= 0) {
            throw new IllegalArgumentException("maxRequestsPerWindow must be positive");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (loginMaxRetries <= 0) {
            throw new IllegalArgumentException("loginMaxRetries must be positive");
        }
        if (baseRetryDelay == null || baseRetryDelay.isNegative() || baseRetryDelay.isZero()) {
            throw new IllegalArgumentException("baseRetryDelay must be positive");
        }
        if (maxRetryDelay == null || maxRetryDelay.compareTo(baseRetryDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay cannot be shorter than baseRetryDelay");
        }
        if (interCallDelay == null || interCallDelay.isNegative()) {
            throw new IllegalArgumentException("interCallDelay cannot be negative");
        }
        if (interBatchDelay == null || interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay cannot be negative");
        }
        if (historyBatchSize <= 0) {
            throw new IllegalArgumentException("historyBatchSize must be positive");
        }
        sessionExpiredCodes = sessionExpiredCodes == null ? Set.of() : Set.copyOf(sessionExpiredCodes);
    }

    /**
     * Defaults used when nothing is configured.
     */
    public static ProviderConfig defaults() {
        return new ProviderConfig(
            30,
            Duration.ofSeconds(60),
            3,
            Duration.ofSeconds(2),
            Duration.ofSeconds(30),
            Duration.ofMillis(200),
            Duration.ofSeconds(2),
            20,
            Set.of(-1010)
        );
    }

    /**
     * Load from environment variables (or system properties), falling back to {@link #defaults()}.
     */
    public static ProviderConfig fromEnv() {
        ProviderConfig d = defaults();
        return new ProviderConfig(
            Env.getInt("LHB_MAX_REQUESTS_PER_WINDOW", d.maxRequestsPerWindow()),
            Env.getSeconds("LHB_WINDOW_SECONDS", d.window()),
            Env.getInt("LHB_LOGIN_MAX_RETRIES", d.loginMaxRetries()),
            Env.getSeconds("LHB_BASE_RETRY_DELAY_SECONDS", d.baseRetryDelay()),
            Env.getSeconds("LHB_MAX_RETRY_DELAY_SECONDS", d.maxRetryDelay()),
            Env.getMillis("LHB_INTER_CALL_DELAY_MS", d.interCallDelay()),
            Env.getSeconds("LHB_INTER_BATCH_DELAY_SECONDS", d.interBatchDelay()),
            Env.getInt("LHB_HISTORY_BATCH_SIZE", d.historyBatchSize()),
            Set.copyOf(Env.getIntList("LHB_SESSION_EXPIRED_CODES", List.copyOf(d.sessionExpiredCodes())))
        );
    }

    public boolean isSessionExpiredCode(int statusCode) {
        return sessionExpiredCodes.contains(statusCode);
    }
}
