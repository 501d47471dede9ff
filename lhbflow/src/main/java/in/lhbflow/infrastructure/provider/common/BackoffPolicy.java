package in.lhbflow.infrastructure.provider.common;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exponential backoff schedule for bounded retry loops.
 *
 * The delay after failed attempt {@code n} (1-based) is
 * {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}. The policy is stateless:
 * the retry loop owns its attempt counter, which keeps the schedule testable on its own.
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(2))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
 *     if (login()) break;
 *     if (policy.hasNextAttempt(attempt)) sleeper.sleep(policy.delayAfterAttempt(attempt));
 * }
 * </pre>
 */
public final class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based attempt number
     * @return backoff delay, never above maxDelay
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * True if another attempt is allowed after the given one.
     */
    public boolean hasNextAttempt(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Every delay the loop will sleep through when all attempts fail.
     */
    public List<Duration> schedule() {
        List<Duration> delays = new ArrayList<>();
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            delays.add(delayAfterAttempt(attempt));
        }
        return delays;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default login schedule: 3 attempts, 2s then 4s.
     */
    public static BackoffPolicy forLogin() {
        return builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Builder for BackoffPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new BackoffPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
