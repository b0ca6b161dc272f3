package com.prime.client.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.prime.client.fetch.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed fetch cache. Entries have no expiry; a size bound is applied
 * only when {@link CacheConfig#maxSize()} is set.
 */
public class CaffeineFetchCache implements FetchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineFetchCache.class);

    private final Cache<Fingerprint, FetchResult> cache;

    public CaffeineFetchCache(CacheConfig config) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().recordStats();
        if (config.isBounded()) {
            builder.maximumSize(config.maxSize());
        }
        this.cache = builder.build();
        log.info("CaffeineFetchCache initialized: maxSize={}", config.isBounded() ? config.maxSize() : "unbounded");
    }

    @Override
    public Optional<FetchResult> get(Fingerprint fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public void put(Fingerprint fingerprint, FetchResult result) {
        cache.put(fingerprint, result);
        log.debug("Cached fetch {} ({} records)", fingerprint, result.size());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(caffeineStats.hitCount(), caffeineStats.missCount(), cache.estimatedSize());
    }
}
