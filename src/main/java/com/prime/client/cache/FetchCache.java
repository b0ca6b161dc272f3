package com.prime.client.cache;

import com.prime.client.fetch.FetchResult;

import java.util.Optional;

/**
 * Memoizes completed bulk fetches by {@link Fingerprint}.
 * Implementations must allow concurrent reads alongside writes.
 */
public interface FetchCache {

    /**
     * Gets a memoized fetch.
     *
     * @return the cached result, or empty if not cached
     */
    Optional<FetchResult> get(Fingerprint fingerprint);

    /**
     * Stores a completed fetch, replacing any previous entry.
     */
    void put(Fingerprint fingerprint, FetchResult result);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
