package com.forecast.pipeline.cache;

/**
 * Configuration for the stage cache.
 *
 * @param maxSizePerAttribute maximum entries kept per attribute, 0 for unbounded.
 *                            A bounded cache may evict and later recompute entries,
 *                            so repeated reads are then only equal, not identical.
 * @param enabled             whether caching is enabled
 */
public record CacheConfig(long maxSizePerAttribute, boolean enabled) {

    public CacheConfig {
        if (maxSizePerAttribute < 0) {
            throw new IllegalArgumentException("maxSizePerAttribute must be >= 0");
        }
    }

    /**
     * Default configuration: unbounded, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(0, true);
    }

    /**
     * Disabled cache configuration; every read recomputes.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(0, false);
    }

    public boolean isBounded() {
        return maxSizePerAttribute > 0;
    }
}
