package org.sqltx.commons.config;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Resolves configuration values from, in order of precedence:
 * <ol>
 *   <li>JVM system properties ({@code -Dsqltx.retry.maxRetries=5})</li>
 *   <li>environment variables, with dots replaced by underscores and upper-cased
 *       ({@code SQLTX_RETRY_MAXRETRIES=5})</li>
 *   <li>an optional {@link Properties} fallback, typically loaded from
 *       {@code sqltx.properties}</li>
 *   <li>the supplied default</li>
 * </ol>
 * Invalid numeric values are logged and replaced by the default.
 */
@Slf4j
public class PropertyResolver {

    private final Properties fallback;

    public PropertyResolver() {
        this(new Properties());
    }

    /**
     * @param fallback properties consulted after JVM properties and environment variables
     */
    public PropertyResolver(Properties fallback) {
        this.fallback = fallback != null ? fallback : new Properties();
    }

    /**
     * Gets a string property value.
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            log.debug("Using JVM property {}={}", key, value);
            return value;
        }

        String envKey = toEnvironmentKey(key);
        value = System.getenv(envKey);
        if (value != null) {
            log.debug("Using environment variable {}={}", envKey, value);
            return value;
        }

        value = fallback.getProperty(key);
        if (value != null) {
            log.debug("Using configured property {}={}", key, value);
            return value;
        }

        log.debug("Using default value for {}: {}", key, defaultValue);
        return defaultValue;
    }

    /**
     * Gets an integer property value with validation.
     */
    public int getInt(String key, int defaultValue) {
        String value = getString(key, String.valueOf(defaultValue));
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer value for property '{}': {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Gets a long property value with validation.
     */
    public long getLong(String key, long defaultValue) {
        String value = getString(key, String.valueOf(defaultValue));
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long value for property '{}': {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Gets a boolean property value.
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        return Boolean.parseBoolean(getString(key, String.valueOf(defaultValue)).trim());
    }

    /**
     * Gets a list property value (comma-separated).
     */
    public List<String> getList(String key, List<String> defaultValue) {
        String value = getString(key, String.join(",", defaultValue));
        if (value.trim().isEmpty()) {
            return new ArrayList<>(defaultValue);
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static String toEnvironmentKey(String key) {
        return key.replace('.', '_').toUpperCase();
    }
}
