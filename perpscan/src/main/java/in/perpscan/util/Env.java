package in.perpscan.util;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Environment variable utilities.
 * Environment variables win over system properties; blank values count as unset.
 */
public final class Env {

    public static Optional<String> find(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public static String get(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    public static BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        return find(key).map(v -> {
            try {
                return new BigDecimal(v);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }).orElse(defaultValue);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        return find(key)
            .map(v -> "true".equalsIgnoreCase(v) || "1".equals(v))
            .orElse(defaultValue);
    }

    private Env() {}
}
