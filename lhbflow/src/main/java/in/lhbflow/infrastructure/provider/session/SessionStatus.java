package in.lhbflow.infrastructure.provider.session;

/**
 * Login state of the shared upstream session.
 */
public enum SessionStatus {
    LOGGED_OUT,
    LOGGING_IN,
    LOGGED_IN
}
