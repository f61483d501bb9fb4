package com.symderiv.calculus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for the differentiation engine.
 *
 * <p>Instances are immutable. {@link #fromSystemProperties()} reads the
 * following JVM system properties, falling back to the defaults when a
 * property is missing or invalid:
 * <ul>
 *   <li>{@code symderiv.cache.enabled} - memoize derivatives of repeated
 *       subtrees (default {@code false})</li>
 *   <li>{@code symderiv.cache.maxEntries} - cache capacity before least
 *       recently used entries are evicted (default {@code 10000})</li>
 *   <li>{@code symderiv.maxDepth} - deepest expression tree the engine will
 *       accept (default {@code 10000})</li>
 * </ul>
 */
public final class DifferentiationConfig {

    private static final Logger logger = LoggerFactory.getLogger(DifferentiationConfig.class);

    public static final String PROP_CACHE_ENABLED = "symderiv.cache.enabled";
    public static final String PROP_CACHE_MAX_ENTRIES = "symderiv.cache.maxEntries";
    public static final String PROP_MAX_DEPTH = "symderiv.maxDepth";

    public static final boolean DEFAULT_CACHE_ENABLED = false;
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 10_000;
    public static final int DEFAULT_MAX_DEPTH = 10_000;

    private static final DifferentiationConfig DEFAULTS = new DifferentiationConfig(
        DEFAULT_CACHE_ENABLED, DEFAULT_CACHE_MAX_ENTRIES, DEFAULT_MAX_DEPTH);

    private final boolean cacheEnabled;
    private final int cacheMaxEntries;
    private final int maxDepth;

    private DifferentiationConfig(boolean cacheEnabled, int cacheMaxEntries, int maxDepth) {
        this.cacheEnabled = cacheEnabled;
        this.cacheMaxEntries = cacheMaxEntries;
        this.maxDepth = maxDepth;
    }

    /**
     * Returns the default configuration: no cache, depth limit of 10000.
     *
     * @return the defaults
     */
    public static DifferentiationConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a configuration from JVM system properties.
     *
     * @return the configuration
     */
    public static DifferentiationConfig fromSystemProperties() {
        DifferentiationConfig config = new DifferentiationConfig(
            getConfiguredBoolean(PROP_CACHE_ENABLED, DEFAULT_CACHE_ENABLED),
            getConfiguredPositiveInt(PROP_CACHE_MAX_ENTRIES, DEFAULT_CACHE_MAX_ENTRIES),
            getConfiguredPositiveInt(PROP_MAX_DEPTH, DEFAULT_MAX_DEPTH));
        logger.debug("Loaded differentiation config: {}", config);
        return config;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public int cacheMaxEntries() {
        return cacheMaxEntries;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public DifferentiationConfig withCacheEnabled(boolean enabled) {
        return new DifferentiationConfig(enabled, cacheMaxEntries, maxDepth);
    }

    /**
     * Returns a copy with a different cache capacity.
     *
     * @param maxEntries the capacity, must be positive
     * @return the new configuration
     * @throws IllegalArgumentException if maxEntries is not positive
     */
    public DifferentiationConfig withCacheMaxEntries(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        return new DifferentiationConfig(cacheEnabled, maxEntries, maxDepth);
    }

    /**
     * Returns a copy with a different depth limit.
     *
     * @param depth the limit, must be positive
     * @return the new configuration
     * @throws IllegalArgumentException if depth is not positive
     */
    public DifferentiationConfig withMaxDepth(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + depth);
        }
        return new DifferentiationConfig(cacheEnabled, cacheMaxEntries, depth);
    }

    @Override
    public String toString() {
        return String.format("DifferentiationConfig(cacheEnabled=%s, cacheMaxEntries=%d, maxDepth=%d)",
                             cacheEnabled, cacheMaxEntries, maxDepth);
    }

    // ========== Configuration Helpers ==========

    private static boolean getConfiguredBoolean(String property, boolean defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        logger.warn("Ignoring invalid value '{}' for {}, using default {}", value, property, defaultValue);
        return defaultValue;
    }

    private static int getConfiguredPositiveInt(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
            logger.warn("Ignoring non-positive value {} for {}, using default {}", parsed, property, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparsable value '{}' for {}, using default {}", value, property, defaultValue);
        }
        return defaultValue;
    }
}
