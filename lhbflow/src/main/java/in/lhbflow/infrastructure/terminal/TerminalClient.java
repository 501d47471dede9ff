package in.lhbflow.infrastructure.terminal;

import java.util.List;

/**
 * The three remote operations offered by the upstream financial-data terminal.
 *
 * Implementations perform exactly one physical call per method invocation and never retry;
 * retries, throttling and session recovery belong to the provider layer.
 */
public interface TerminalClient {

    /**
     * Log in.
     *
     * @return raw status code; 0 and -201 both mean the session is usable
     * @throws TerminalException if the call itself fails
     */
    int login(String userId, String secret);

    /**
     * Log out. May throw; callers treat logout as best effort.
     */
    void logout();

    /**
     * Run one query.
     *
     * @param operation logical query type
     * @param params    positional string parameters, see {@link TerminalOperation}
     * @return the untyped answer, to be normalized by the caller
     * @throws TerminalException if the call itself fails
     */
    RawResponse invoke(TerminalOperation operation, List<String> params);

    /**
     * Client name for logs and metrics.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
