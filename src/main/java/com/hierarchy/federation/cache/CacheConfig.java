package com.hierarchy.federation.cache;

/**
 * Configuration for the view cache.
 *
 * @param maxSize    maximum number of cached views
 * @param ttlSeconds time-to-live in seconds for each view
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 256 views, one hour, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(256, 3_600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
