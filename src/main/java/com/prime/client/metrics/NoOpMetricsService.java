package com.prime.client.metrics;

import com.prime.client.error.ErrorCategory;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFetchDuration(String resource, Duration duration) {
    }

    @Override
    public void recordPageDuration(String resource, Duration duration) {
    }

    @Override
    public void recordRecordsFetched(String resource, int records) {
    }

    @Override
    public void incrementHoldPauses() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementErrors(ErrorCategory category) {
    }
}
