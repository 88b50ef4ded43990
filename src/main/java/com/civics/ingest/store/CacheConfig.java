package com.civics.ingest.store;

/**
 * Settings for {@link CachingCanonicalStore}.
 *
 * @param maxSize    maximum number of cached crosswalk lookups
 * @param ttlSeconds time-to-live of each entry
 * @param enabled    whether the store is wrapped at all
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
     * 10,000 entries, 300s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 300, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
