package in.lhbflow.infrastructure.provider.common;

import in.lhbflow.infrastructure.provider.metrics.ProviderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter for outbound calls against the shared upstream quota.
 *
 * At most {@code maxRequests} calls are admitted inside any window of length {@code window}.
 * Callers over the quota block instead of failing; the wait is recomputed in a loop after every
 * sleep, so an early wake-up or a competing caller cannot push the rate over the bound.
 * The lock guards only the timestamp queue and is never held while sleeping.
 *
 * Usage:
 * <pre>
 * RateLimiter limiter = new RateLimiter(30, Duration.ofMinutes(1));
 * limiter.acquire();   // may block
 * terminal.invoke(...);
 * </pre>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration DEFAULT_EPSILON = Duration.ofMillis(100);

    private final int maxRequests;
    private final long windowNanos;
    private final long epsilonNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ProviderMetrics metrics;

    private final Object lock = new Object();
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public RateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, DEFAULT_EPSILON, System::nanoTime, Sleeper.SYSTEM, ProviderMetrics.NOOP);
    }

    public RateLimiter(int maxRequests, Duration window, ProviderMetrics metrics) {
        this(maxRequests, window, DEFAULT_EPSILON, System::nanoTime, Sleeper.SYSTEM, metrics);
    }

    public RateLimiter(int maxRequests, Duration window, Duration epsilon,
                       LongSupplier nanoClock, Sleeper sleeper, ProviderMetrics metrics) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (epsilon == null || epsilon.isNegative()) {
            throw new IllegalArgumentException("epsilon cannot be negative");
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.epsilonNanos = epsilon.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.metrics = metrics == null ? ProviderMetrics.NOOP : metrics;
    }

    /**
     * Block until a slot is free, then take it.
     *
     * @throws InterruptedException if the caller is interrupted while waiting; no slot is taken
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            synchronized (lock) {
                long now = nanoClock.getAsLong();
                evictExpired(now);

                if (timestamps.size() < maxRequests) {
                    timestamps.addLast(now);
                    return;
                }

                long oldest = timestamps.peekFirst();
                waitNanos = windowNanos - (now - oldest) + epsilonNanos;
            }

            Duration wait = Duration.ofNanos(Math.max(waitNanos, 0));
            log.warn("[RateLimiter] Quota of {} calls per {}s reached, waiting {}ms",
                maxRequests, windowNanos / 1_000_000_000.0, wait.toMillis());
            metrics.recordRateLimitWait(wait);
            sleeper.sleep(wait);
        }
    }

    /**
     * Calls recorded inside the current window.
     */
    public int recordedInWindow() {
        synchronized (lock) {
            evictExpired(nanoClock.getAsLong());
            return timestamps.size();
        }
    }

    private void evictExpired(long now) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() > windowNanos) {
            timestamps.pollFirst();
        }
    }
}
