package in.lhbflow.infrastructure.provider.resolve;

import in.lhbflow.config.ProviderConfig;
import in.lhbflow.domain.model.Query;
import in.lhbflow.infrastructure.provider.common.RateLimiter;
import in.lhbflow.infrastructure.provider.metrics.ProviderMetrics;
import in.lhbflow.infrastructure.provider.response.NormalizedResult;
import in.lhbflow.infrastructure.provider.response.NormalizedRow;
import in.lhbflow.infrastructure.provider.response.ResponseNormalizer;
import in.lhbflow.infrastructure.provider.session.SessionManager;
import in.lhbflow.infrastructure.terminal.RawResponse;
import in.lhbflow.infrastructure.terminal.TerminalClient;
import in.lhbflow.infrastructure.terminal.TerminalException;
import in.lhbflow.infrastructure.terminal.TerminalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Tries candidate invocation shapes one after another until one returns data.
 *
 * <p>Candidates run strictly in order, never in parallel, each behind a session check and a
 * rate limiter slot. A failed call, an unrecognized answer or an empty answer just moves on to
 * the next candidate. When the terminal reports an expired session the session is dropped, so
 * the next candidate logs in again first.
 *
 * <p>Never throws. Only an answer without a status, or with status 0, counts as a genuine "no
 * data" ({@link ResolutionOutcome#EXHAUSTED}). When every candidate failed or answered with an
 * error code the outcome is {@link ResolutionOutcome#UNAVAILABLE}, or
 * {@link ResolutionOutcome#SESSION_LOST} when each of them lacked or lost the session.
 */
public class FallbackQueryResolver {
    private static final Logger log = LoggerFactory.getLogger(FallbackQueryResolver.class);

    private final TerminalClient terminal;
    private final SessionManager sessionManager;
    private final RateLimiter rateLimiter;
    private final ResponseNormalizer normalizer;
    private final ProviderConfig config;
    private final ProviderMetrics metrics;

    public FallbackQueryResolver(TerminalClient terminal, SessionManager sessionManager, RateLimiter rateLimiter,
                                 ResponseNormalizer normalizer, ProviderConfig config, ProviderMetrics metrics) {
        this.terminal = terminal;
        this.sessionManager = sessionManager;
        this.rateLimiter = rateLimiter;
        this.normalizer = normalizer;
        this.config = config;
        this.metrics = metrics == null ? ProviderMetrics.NOOP : metrics;
    }

    public Resolution resolve(Query query, List<InvocationShape> candidates) {
        return resolve(query, candidates, SuccessPredicate.NON_EMPTY_OK);
    }

    public Resolution resolve(Query query, List<InvocationShape> candidates, SuccessPredicate isSuccess) {
        List<AttemptTrace> trace = new ArrayList<>();
        boolean answeredEmpty = false;
        boolean sessionLostOnly = true;

        for (InvocationShape shape : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                return finish(query, ResolutionOutcome.CANCELLED, List.of(), trace);
            }

            if (!sessionManager.ensureActive()) {
                if (Thread.currentThread().isInterrupted()) {
                    return finish(query, ResolutionOutcome.CANCELLED, List.of(), trace);
                }
                trace.add(AttemptTrace.failed(shape.description(), AttemptTrace.NO_SESSION, Duration.ZERO));
                metrics.recordAttempt(shape.operation().name(), "NO_SESSION", Duration.ZERO);
                log.debug("[FallbackQueryResolver] {} skipped: no session", shape.description());
                continue;
            }

            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(query, ResolutionOutcome.CANCELLED, List.of(), trace);
            }

            long start = System.nanoTime();
            RawResponse raw;
            try {
                raw = terminal.invoke(shape.operation(), shape.params());
            } catch (RuntimeException e) {
                Duration latency = Duration.ofNanos(System.nanoTime() - start);
                trace.add(AttemptTrace.failed(shape.description(), e.getClass().getSimpleName() + ": " + e.getMessage(), latency));
                if (e instanceof TerminalException && ((TerminalException) e).isSessionLost()) {
                    sessionManager.markExpired(TerminalStatus.NOT_LOGGED_IN);
                    metrics.recordAttempt(shape.operation().name(), "SESSION_LOST", latency);
                } else {
                    sessionLostOnly = false;
                    metrics.recordAttempt(shape.operation().name(), "EXCEPTION", latency);
                }
                log.debug("[FallbackQueryResolver] {} failed: {}", shape.description(), e.getMessage());
                continue;
            }
            Duration latency = Duration.ofNanos(System.nanoTime() - start);

            NormalizedResult result = normalizer.normalize(raw);
            OptionalInt status = result.statusCode();
            AttemptTrace attempt = new AttemptTrace(shape.description(), raw == null ? "null" : raw.typeName(),
                status, result.rowCount(), latency, null);
            trace.add(attempt);
            log.debug("[FallbackQueryResolver] {}", attempt);

            boolean expired = status.isPresent() && config.isSessionExpiredCode(status.getAsInt());
            if (expired) {
                sessionManager.markExpired(status.getAsInt());
            }

            if (isSuccess.test(status, result.rowCount())) {
                metrics.recordAttempt(shape.operation().name(), "SUCCESS", latency);
                return finish(query, ResolutionOutcome.SUCCESS, result.rows(), trace);
            }

            boolean errorStatus = status.isPresent() && status.getAsInt() != TerminalStatus.SUCCESS;
            if (!errorStatus) {
                answeredEmpty = true;
            }
            if (!expired) {
                sessionLostOnly = false;
            }
            metrics.recordAttempt(shape.operation().name(),
                expired ? "SESSION_EXPIRED" : errorStatus ? "STATUS_ERROR" : "EMPTY", latency);
        }

        ResolutionOutcome outcome;
        if (answeredEmpty || candidates.isEmpty()) {
            outcome = ResolutionOutcome.EXHAUSTED;
        } else if (sessionLostOnly) {
            outcome = ResolutionOutcome.SESSION_LOST;
        } else {
            outcome = ResolutionOutcome.UNAVAILABLE;
        }
        log.info("[FallbackQueryResolver] {} {}..{}: no data after {} attempts ({})",
            query.kind(), query.startDate(), query.endDate(), trace.size(), outcome);
        return finish(query, outcome, List.of(), trace);
    }

    private Resolution finish(Query query, ResolutionOutcome outcome, List<NormalizedRow> rows, List<AttemptTrace> trace) {
        if (outcome == ResolutionOutcome.CANCELLED) {
            log.info("[FallbackQueryResolver] {} cancelled after {} attempts", query.kind(), trace.size());
        }
        metrics.recordResolution(query.kind().name(), outcome.name(), trace.size());
        return new Resolution(outcome, rows, trace);
    }
}
