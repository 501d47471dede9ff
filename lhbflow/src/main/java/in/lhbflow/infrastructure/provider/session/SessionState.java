package in.lhbflow.infrastructure.provider.session;

/**
 * Point-in-time view of the session. Only {@link SessionManager} creates these.
 *
 * @param status     current login state
 * @param lastError  last login failure or expiry reason, null when none
 * @param retryCount login attempts made by the latest EnsureActive round
 */
public record SessionState(SessionStatus status, String lastError, int retryCount) {

    public static SessionState initial() {
        return new SessionState(SessionStatus.LOGGED_OUT, null, 0);
    }

    public boolean isLoggedIn() {
        return status == SessionStatus.LOGGED_IN;
    }

    SessionState withStatus(SessionStatus newStatus) {
        return new SessionState(newStatus, lastError, retryCount);
    }

    SessionState withError(String error) {
        return new SessionState(status, error, retryCount);
    }

    SessionState withRetryCount(int count) {
        return new SessionState(status, lastError, count);
    }
}
