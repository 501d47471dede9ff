package in.lhbflow.config;

import in.lhbflow.util.Env;

/**
 * Account used to log in to the upstream terminal.
 */
public record TerminalCredentials(String userId, String secret, String baseUrl) {

    public static TerminalCredentials fromEnv() {
        return new TerminalCredentials(
            Env.get("THS_USER_ID", null),
            Env.get("THS_PASSWORD", null),
            Env.get("THS_BASE_URL", "https://quantapi.51ifind.com/api/v1")
        );
    }

    public boolean isComplete() {
        return userId != null && !userId.isBlank() && secret != null && !secret.isBlank();
    }

    @Override
    public String toString() {
        return "TerminalCredentials[userId=" + userId + ", secret=" + mask(secret) + ", baseUrl=" + baseUrl + "]";
    }

    private static String mask(String value) {
        if (value == null || value.isEmpty()) return "<unset>";
        if (value.length() <= 4) return "****";
        return value.substring(0, 2) + "****" + value.substring(value.length() - 2);
    }
}
