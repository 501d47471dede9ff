package in.lhbflow.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProviderConfig and TerminalCredentials.
 *
 * fromEnv() falls back to system properties, which is what these tests set.
 */
class ProviderConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("LHB_MAX_REQUESTS_PER_WINDOW");
        System.clearProperty("LHB_INTER_CALL_DELAY_MS");
        System.clearProperty("LHB_SESSION_EXPIRED_CODES");
        System.clearProperty("LHB_HISTORY_BATCH_SIZE");
        System.clearProperty("THS_USER_ID");
        System.clearProperty("THS_PASSWORD");
    }

    @Test
    void testDefaults() {
        ProviderConfig config = ProviderConfig.defaults();

        assertEquals(30, config.maxRequestsPerWindow());
        assertEquals(Duration.ofSeconds(60), config.window());
        assertEquals(3, config.loginMaxRetries());
        assertEquals(Duration.ofSeconds(2), config.baseRetryDelay());
        assertEquals(Duration.ofMillis(200), config.interCallDelay());
        assertEquals(20, config.historyBatchSize());
        assertTrue(config.isSessionExpiredCode(-1010));
        assertFalse(config.isSessionExpiredCode(0));
    }

    @Test
    void testFromEnvReadsOverrides() {
        System.setProperty("LHB_MAX_REQUESTS_PER_WINDOW", "10");
        System.setProperty("LHB_INTER_CALL_DELAY_MS", "50");
        System.setProperty("LHB_SESSION_EXPIRED_CODES", "-1010, -1020,junk");
        System.setProperty("LHB_HISTORY_BATCH_SIZE", "not-a-number");

        ProviderConfig config = ProviderConfig.fromEnv();

        assertEquals(10, config.maxRequestsPerWindow());
        assertEquals(Duration.ofMillis(50), config.interCallDelay());
        assertEquals(Set.of(-1010, -1020), config.sessionExpiredCodes());
        assertEquals(20, config.historyBatchSize(), "Unparseable values fall back to the default");
    }

    @Test
    void testValidation() {
        Duration s = Duration.ofSeconds(1);
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderConfig(0, s, 3, s, s, s, s, 20, Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderConfig(30, Duration.ZERO, 3, s, s, s, s, 20, Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderConfig(30, s, 3, Duration.ofSeconds(5), s, s, s, 20, Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderConfig(30, s, 3, s, s, Duration.ofMillis(-1), s, 20, Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderConfig(30, s, 3, s, s, s, s, 0, Set.of()));
    }

    @Test
    void testCredentialsAreMasked() {
        System.setProperty("THS_USER_ID", "acct01");
        System.setProperty("THS_PASSWORD", "hunter2");

        TerminalCredentials credentials = TerminalCredentials.fromEnv();

        assertTrue(credentials.isComplete());
        assertFalse(credentials.toString().contains("hunter2"), "Secret must not be logged");
        assertFalse(new TerminalCredentials("acct01", "", credentials.baseUrl()).isComplete());
    }
}
