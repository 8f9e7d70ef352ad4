package com.streamfleet.controlplane.config;

import java.time.Duration;
import java.util.function.Function;

/**
 * Environment variable lookup shared by the {@code fromEnv()} factories.
 */
final class EnvSupport {
    private EnvSupport() {
    }

    static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    static int getInt(String key, int defaultValue) {
        return parse(key, getEnv(key, String.valueOf(defaultValue)), Integer::parseInt);
    }

    static double getDouble(String key, double defaultValue) {
        return parse(key, getEnv(key, String.valueOf(defaultValue)), Double::parseDouble);
    }

    static boolean getBoolean(String key, boolean defaultValue) {
        return Boolean.parseBoolean(getEnv(key, String.valueOf(defaultValue)));
    }

    static Duration getSeconds(String key, long defaultSeconds) {
        return Duration.ofSeconds(parse(key, getEnv(key, String.valueOf(defaultSeconds)), Long::parseLong));
    }

    private static <T> T parse(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }

    static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException(name + " must be a positive duration, got " + value);
        }
    }

    static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(name + " must not be negative, got " + value);
        }
    }
}
