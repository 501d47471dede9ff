package in.lhbflow.infrastructure.terminal;

/**
 * Status codes returned by the upstream terminal.
 */
public final class TerminalStatus {

    public static final int SUCCESS = 0;

    /**
     * Soft error: the account already holds a session elsewhere. Some account tiers return it
     * for a perfectly good login, so it counts as logged in.
     */
    public static final int SESSION_ALREADY_ACTIVE = -201;

    /**
     * Not logged in / session gone. The default member of the configurable expiry code set.
     */
    public static final int NOT_LOGGED_IN = -1010;

    public static boolean isLoginAccepted(int code) {
        return code == SUCCESS || code == SESSION_ALREADY_ACTIVE;
    }

    private TerminalStatus() {}
}
