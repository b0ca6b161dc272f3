package com.prime.client.cache;

import com.prime.client.fetch.FetchResult;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used when caching is disabled.
 */
public class NoOpFetchCache implements FetchCache {

    @Override
    public Optional<FetchResult> get(Fingerprint fingerprint) {
        return Optional.empty();
    }

    @Override
    public void put(Fingerprint fingerprint, FetchResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
