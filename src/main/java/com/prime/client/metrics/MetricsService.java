package com.prime.client.metrics;

import com.prime.client.error.ErrorCategory;

import java.time.Duration;

/**
 * Interface for recording client metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordFetchDuration(String resource, Duration duration);

    void recordPageDuration(String resource, Duration duration);

    void recordRecordsFetched(String resource, int records);

    void incrementHoldPauses();

    void recordCacheHit();

    void recordCacheMiss();

    void incrementErrors(ErrorCategory category);
}
