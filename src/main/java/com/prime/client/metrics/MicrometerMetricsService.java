package com.prime.client.metrics;

import com.prime.client.error.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code prime.fetch.duration} - Timer (tag: resource)</li>
 *   <li>{@code prime.page.duration} - Timer (tag: resource)</li>
 *   <li>{@code prime.fetch.records} - DistributionSummary (tag: resource)</li>
 *   <li>{@code prime.hold.pauses} - Counter</li>
 *   <li>{@code prime.cache.hit} - Counter</li>
 *   <li>{@code prime.cache.miss} - Counter</li>
 *   <li>{@code prime.errors} - Counter (tag: category)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Map<ErrorCategory, Counter> errorCounters = new ConcurrentHashMap<>();
    private final Counter holdPauseCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.holdPauseCounter = Counter.builder("prime.hold.pauses")
                .description("Number of hold pauses between chunks of page requests")
                .register(registry);
        this.cacheHitCounter = Counter.builder("prime.cache.hit")
                .description("Number of fetch cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("prime.cache.miss")
                .description("Number of fetch cache misses")
                .register(registry);
    }

    @Override
    public void recordFetchDuration(String resource, Duration duration) {
        timer("prime.fetch.duration", "Duration of complete bulk fetches", resource).record(duration);
    }

    @Override
    public void recordPageDuration(String resource, Duration duration) {
        timer("prime.page.duration", "Duration of individual page requests", resource).record(duration);
    }

    @Override
    public void recordRecordsFetched(String resource, int records) {
        summaryCache.computeIfAbsent(resource, k ->
                DistributionSummary.builder("prime.fetch.records")
                        .description("Number of records returned per bulk fetch")
                        .tag("resource", resource)
                        .register(registry))
                .record(records);
    }

    @Override
    public void incrementHoldPauses() {
        holdPauseCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementErrors(ErrorCategory category) {
        errorCounters.computeIfAbsent(category, c ->
                Counter.builder("prime.errors")
                        .description("Number of failed client operations")
                        .tag("category", c.name())
                        .register(registry))
                .increment();
    }

    private Timer timer(String name, String description, String resource) {
        return timerCache.computeIfAbsent(name + ":" + resource, k ->
                Timer.builder(name)
                        .description(description)
                        .tag("resource", resource)
                        .register(registry));
    }
}
