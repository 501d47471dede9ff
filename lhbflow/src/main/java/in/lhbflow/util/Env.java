package in.lhbflow.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Environment variable utilities.
 * Environment variables win over system properties; blank values count as unset.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static Duration getSeconds(String key, Duration defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(value.trim()) * 1000));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static Duration getMillis(String key, Duration defaultValue) {
        long millis = getLong(key, -1);
        return millis < 0 ? defaultValue : Duration.ofMillis(millis);
    }

    /**
     * Comma separated integers, e.g. "-1010,-1020". Unparseable entries are skipped.
     */
    public static List<Integer> getIntList(String key, List<Integer> defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        List<Integer> result = new ArrayList<>();
        for (String part : value.split(",")) {
            try {
                result.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException ignored) {
                // skip garbage entries, keep the rest
            }
        }
        return result.isEmpty() ? defaultValue : List.copyOf(result);
    }

    private Env() {}
}
