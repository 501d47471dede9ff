package in.lhbflow.infrastructure.terminal;

/**
 * Thrown when a physical call to the upstream terminal fails (I/O, timeout, HTTP error).
 */
public class TerminalException extends RuntimeException {

    private final TerminalOperation operation;
    private final boolean sessionLost;

    public TerminalException(TerminalOperation operation, String message) {
        this(operation, message, false);
    }

    public TerminalException(TerminalOperation operation, String message, boolean sessionLost) {
        super(format(operation, message));
        this.operation = operation;
        this.sessionLost = sessionLost;
    }

    public TerminalException(TerminalOperation operation, String message, Throwable cause) {
        super(format(operation, message), cause);
        this.operation = operation;
        this.sessionLost = false;
    }

    /**
     * The client holds no usable session; the caller should log in again before retrying.
     */
    public static TerminalException notLoggedIn(TerminalOperation operation) {
        return new TerminalException(operation, "Not logged in", true);
    }

    /**
     * Operation that failed, or null for login/logout.
     */
    public TerminalOperation getOperation() {
        return operation;
    }

    public boolean isSessionLost() {
        return sessionLost;
    }

    private static String format(TerminalOperation operation, String message) {
        return String.format("[%s] %s", operation == null ? "SESSION" : operation.name(), message);
    }
}
