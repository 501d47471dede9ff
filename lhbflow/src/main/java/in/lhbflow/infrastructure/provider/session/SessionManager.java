package in.lhbflow.infrastructure.provider.session;

import in.lhbflow.config.TerminalCredentials;
import in.lhbflow.infrastructure.provider.common.BackoffPolicy;
import in.lhbflow.infrastructure.provider.common.Sleeper;
import in.lhbflow.infrastructure.provider.metrics.ProviderMetrics;
import in.lhbflow.infrastructure.terminal.TerminalClient;
import in.lhbflow.infrastructure.terminal.TerminalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owner of the single logical session against the upstream terminal.
 *
 * Features:
 * - Idempotent {@link #ensureActive()}: no network call while logged in
 * - Bounded login retries with exponential backoff
 * - Accepts the "already active elsewhere" soft error as a good login
 * - Best-effort logout that never throws
 * - Expiry reset driven by status codes seen on queries
 *
 * Login failures never escape as exceptions; callers get a boolean and move on.
 * Logins are serialized on a dedicated lock, held through the backoff sleeps, so only one
 * caller logs in while the others wait for its outcome. Session state sits behind a separate
 * monitor: {@link #snapshot()}, {@link #markExpired(int)} and {@link #close()} never wait for
 * a login in progress.
 *
 * Usage:
 * <pre>
 * try (SessionManager session = new SessionManager(client, credentials, BackoffPolicy.forLogin())) {
 *     if (session.ensureActive()) {
 *         client.invoke(...);
 *     }
 * }
 * </pre>
 */
public class SessionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final TerminalClient client;
    private final TerminalCredentials credentials;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final ProviderMetrics metrics;

    private final ReentrantLock loginLock = new ReentrantLock();
    private final Object stateLock = new Object();
    private SessionState state = SessionState.initial();

    public SessionManager(TerminalClient client, TerminalCredentials credentials, BackoffPolicy backoffPolicy) {
        this(client, credentials, backoffPolicy, Sleeper.SYSTEM, ProviderMetrics.NOOP);
    }

    public SessionManager(TerminalClient client, TerminalCredentials credentials, BackoffPolicy backoffPolicy,
                          Sleeper sleeper, ProviderMetrics metrics) {
        this.client = client;
        this.credentials = credentials;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics == null ? ProviderMetrics.NOOP : metrics;
    }

    /**
     * Make sure a session is usable, logging in if needed.
     *
     * @return true if logged in; false once every login attempt failed or the thread was
     *         interrupted during backoff (the interrupt flag is preserved)
     */
    public boolean ensureActive() {
        if (isActive()) {
            return true;
        }
        try {
            loginLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        try {
            // another caller may have logged in while we waited
            if (isActive()) {
                return true;
            }
            return loginWithRetries();
        } finally {
            loginLock.unlock();
        }
    }

    private boolean loginWithRetries() {
        int maxAttempts = backoffPolicy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int current = attempt;
            update(s -> s.withRetryCount(current));
            if (login()) {
                if (attempt > 1) {
                    log.info("[SessionManager] Logged in on attempt {}/{}", attempt, maxAttempts);
                }
                return true;
            }

            if (!backoffPolicy.hasNextAttempt(attempt)) {
                break;
            }

            Duration delay = backoffPolicy.delayAfterAttempt(attempt);
            log.warn("[SessionManager] Login attempt {}/{} failed ({}), retrying in {}ms",
                attempt, maxAttempts, snapshot().lastError(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[SessionManager] Interrupted during login backoff");
                return false;
            }
        }

        log.error("[SessionManager] Giving up after {} login attempts, last error: {}",
            maxAttempts, snapshot().lastError());
        return false;
    }

    /**
     * Issue exactly one login call.
     *
     * @return true if the session is now usable
     */
    public boolean login() {
        loginLock.lock();
        try {
            return loginOnce();
        } finally {
            loginLock.unlock();
        }
    }

    private boolean loginOnce() {
        if (credentials == null || !credentials.isComplete()) {
            update(s -> s.withStatus(SessionStatus.LOGGED_OUT).withError("Missing terminal credentials"));
            log.error("[SessionManager] Terminal credentials are not configured");
            return false;
        }

        update(s -> s.withStatus(SessionStatus.LOGGING_IN));
        Instant start = Instant.now();
        try {
            int code = client.login(credentials.userId(), credentials.secret());
            Duration latency = Duration.between(start, Instant.now());

            if (TerminalStatus.isLoginAccepted(code)) {
                update(s -> new SessionState(SessionStatus.LOGGED_IN, null, s.retryCount()));
                metrics.recordAuthentication(true, latency);
                if (code == TerminalStatus.SESSION_ALREADY_ACTIVE) {
                    log.info("[SessionManager] Login returned {} (session already active), treating as logged in", code);
                } else {
                    log.info("[SessionManager] Logged in to {} as {}", client.getName(), credentials.userId());
                }
                return true;
            }

            update(s -> s.withStatus(SessionStatus.LOGGED_OUT).withError("Login rejected with code " + code));
            metrics.recordAuthentication(false, latency);
            log.error("[SessionManager] Login rejected, code {}", code);
            return false;

        } catch (RuntimeException e) {
            update(s -> s.withStatus(SessionStatus.LOGGED_OUT).withError(e.getMessage()));
            metrics.recordAuthentication(false, Duration.between(start, Instant.now()));
            log.error("[SessionManager] Login call failed: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Best-effort logout. Only talks to the terminal when logged in; always ends LOGGED_OUT.
     */
    public void logout() {
        synchronized (stateLock) {
            if (state.isLoggedIn()) {
                try {
                    client.logout();
                    log.info("[SessionManager] Logged out of {}", client.getName());
                } catch (RuntimeException e) {
                    log.warn("[SessionManager] Logout failed, dropping session anyway: {}", e.getMessage());
                }
            }
            state = state.withStatus(SessionStatus.LOGGED_OUT);
        }
    }

    /**
     * Drop the session after the terminal answered with an expiry code.
     * The next {@link #ensureActive()} logs in again.
     */
    public void markExpired(int statusCode) {
        synchronized (stateLock) {
            if (state.isLoggedIn()) {
                log.warn("[SessionManager] Session expired (code {}), will log in again", statusCode);
                metrics.recordSessionExpired();
            }
            state = state.withStatus(SessionStatus.LOGGED_OUT).withError("Session expired with code " + statusCode);
        }
    }

    public boolean isActive() {
        return snapshot().isLoggedIn();
    }

    public SessionState snapshot() {
        synchronized (stateLock) {
            return state;
        }
    }

    @Override
    public void close() {
        logout();
    }

    private void update(UnaryOperator<SessionState> change) {
        synchronized (stateLock) {
            state = change.apply(state);
        }
    }
}
