package com.prime.client.cache;

/**
 * Configuration for the fetch cache.
 *
 * <p>Entries never expire; they live until the cache is invalidated or the
 * client is discarded. {@code maxSize} bounds the number of memoized fetches,
 * 0 meaning unbounded.</p>
 *
 * @param maxSize maximum number of entries, 0 for no limit
 * @param enabled whether caching is enabled
 */
public record CacheConfig(long maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0");
        }
    }

    /**
     * Default cache configuration: unbounded, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(0, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(0, false);
    }

    public boolean isBounded() {
        return maxSize > 0;
    }
}
