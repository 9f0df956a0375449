package io.opaquotes.util;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;

/**
 * Environment variable utilities.
 * Environment wins; JVM system properties (-DKEY=value) are the fallback.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Millisecond setting read as a Duration.
     */
    public static Duration getMillis(String key, long defaultMillis) {
        return Duration.ofMillis(getLong(key, defaultMillis));
    }

    /**
     * Enum setting, matched case-insensitively with '-' read as '_'.
     *
     * @throws IllegalStateException if the key is set to a value that names no constant
     */
    public static <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("INVALID CONFIG: " + key + "=" + value + " must be one of "
                + Arrays.toString(type.getEnumConstants()) + "\nSystem refuses to start.", e);
        }
    }

    private Env() {}
}
