package com.prime.client.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.prime.client.error.CancelledException;
import com.prime.client.error.NoResultException;
import com.prime.client.error.PrimeApiException;
import com.prime.client.error.RequestException;
import com.prime.client.http.HttpCall;
import com.prime.client.http.HttpResult;
import com.prime.client.http.HttpTransport;
import com.prime.client.http.QueryEnvelope;
import com.prime.client.http.ResponseClassifier;
import com.prime.client.logging.LogContext;
import com.prime.client.metrics.MetricsService;
import com.prime.client.metrics.NoOpMetricsService;
import com.prime.client.tracing.NoOpTracingService;
import com.prime.client.tracing.Span;
import com.prime.client.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Retrieves every record of a data resource through paginated, paced requests.
 *
 * <p>A fetch runs in four steps:</p>
 * <ol>
 *   <li><b>Count probe</b>: one request with the caller's parameters reads the
 *   record count from the query envelope.</li>
 *   <li><b>Partition</b>: the count is split into pages of
 *   {@link FetchOptions#getPageSize()} records.</li>
 *   <li><b>Chunks</b>: pages are sent in consecutive chunks of at most
 *   {@link FetchOptions#getConcurrency()} parallel requests. Every request of a
 *   chunk completes before the chunk is assessed, and a hold pause follows
 *   every chunk, the last one included, since the server's rate limit applies
 *   per unit of time.</li>
 *   <li><b>Assembly</b>: page records are concatenated by page offset,
 *   independent of completion order.</li>
 * </ol>
 *
 * <p>Failure is fail-fast: the first failing page (in offset order) aborts the
 * fetch and no partial result is returned. Nothing is retried.</p>
 */
public class BatchFetcher {
    private static final Logger log = LoggerFactory.getLogger(BatchFetcher.class);

    private final HttpTransport transport;
    private final ResponseClassifier classifier;
    private final ExecutorService executor;
    private final HoldTimer holdTimer;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public BatchFetcher(HttpTransport transport, ResponseClassifier classifier, ExecutorService executor) {
        this(transport, classifier, executor, HoldTimer.sleeping(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public BatchFetcher(HttpTransport transport, ResponseClassifier classifier, ExecutorService executor,
                        HoldTimer holdTimer, MetricsService metricsService, TracingService tracingService) {
        this.transport = transport;
        this.classifier = classifier;
        this.executor = executor;
        this.holdTimer = holdTimer != null ? holdTimer : HoldTimer.sleeping();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Fetches all records of a data resource.
     *
     * @param resourceName name used in errors, logs and metrics
     * @param url          the resource URL
     * @param baseParams   the caller's query parameters, never modified
     * @param options      paging, pacing and timeout settings
     * @param token        cancels the fetch when triggered
     * @return records in ascending offset order
     * @throws PrimeApiException on the first failure, or {@link CancelledException}
     */
    public FetchResult fetch(String resourceName, String url, Map<String, ?> baseParams,
                             FetchOptions options, CancellationToken token) {
        long startNanos = System.nanoTime();
        try (Span span = tracingService.startSpan(TracingService.FETCH, Map.of("resource", resourceName, "url", url))) {
            try {
                FetchResult result = doFetch(resourceName, url, baseParams, options, token);
                span.setAttribute("pages", result.pageCount());
                span.setAttribute("records", result.size());
                span.setStatus(Span.SpanStatus.OK);
                metricsService.recordFetchDuration(resourceName, Duration.ofNanos(System.nanoTime() - startNanos));
                metricsService.recordRecordsFetched(resourceName, result.size());
                return result;
            } catch (PrimeApiException e) {
                e.initResourceName(resourceName);
                span.fail(e);
                metricsService.incrementErrors(e.getCategory());
                throw e;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private FetchResult doFetch(String resourceName, String url, Map<String, ?> baseParams,
                                FetchOptions options, CancellationToken token) {
        token.throwIfCancelled("Fetch of " + resourceName);

        long count = probeCount(resourceName, url, baseParams, options);
        if (count <= 0) {
            if (options.getZeroCountPolicy() == ZeroCountPolicy.EMPTY) {
                log.info("No records for {} at {}, returning empty result", resourceName, url);
                return FetchResult.empty(resourceName, url);
            }
            throw new NoResultException("No result found for the query " + url
                    + " (resource '" + resourceName + "', params " + baseParams + ")", url, resourceName);
        }

        List<PageRequest> pages = PageRequest.partition(baseParams, count, options.getPageSize());
        List<List<PageRequest>> chunks = PageRequest.chunk(pages, options.getConcurrency());
        log.debug("Fetching {} records of {} in {} pages, {} chunks", count, resourceName, pages.size(), chunks.size());

        List<JsonNode> entities = new ArrayList<>();
        int chunkNumber = 0;
        for (List<PageRequest> chunk : chunks) {
            chunkNumber++;
            token.throwIfCancelled("Fetch of " + resourceName);
            log.debug("Sending chunk {}/{} ({} pages)", chunkNumber, chunks.size(), chunk.size());
            for (List<JsonNode> pageEntities : runChunk(resourceName, url, chunk, options, token)) {
                entities.addAll(pageEntities);
            }
            log.debug("Chunk {}/{} complete, holding {}", chunkNumber, chunks.size(), options.getHoldDuration());
            holdTimer.hold(options.getHoldDuration(), token);
            metricsService.incrementHoldPauses();
        }

        if (entities.size() != count) {
            log.warn("Count probe for {} reported {} records but pages returned {}",
                    resourceName, count, entities.size());
        }
        log.info("Fetched {} records of {} in {} pages", entities.size(), resourceName, pages.size());
        return new FetchResult(resourceName, url, count, pages.size(), entities);
    }

    private long probeCount(String resourceName, String url, Map<String, ?> baseParams, FetchOptions options) {
        HttpResult response = transport.execute(HttpCall.get(url, baseParams, options.getRequestTimeout()));
        // The probe decides on zero counts itself, so the plain classification applies here.
        JsonNode payload = classifier.classify(response);
        QueryEnvelope envelope = QueryEnvelope.of(payload);
        if (!envelope.hasCount()) {
            throw new RequestException("Response of " + response.url() + " carries no record count; '"
                    + resourceName + "' does not look like a data resource", response.url(), response.statusCode());
        }
        log.debug("Count probe for {} reported {} records", resourceName, envelope.count());
        return envelope.count();
    }

    /**
     * Runs one chunk: all pages in parallel, joined before anything is assessed.
     * Returns the page entity lists in page order.
     */
    private List<List<JsonNode>> runChunk(String resourceName, String url, List<PageRequest> chunk,
                                          FetchOptions options, CancellationToken token) {
        List<Future<List<JsonNode>>> futures = new ArrayList<>(chunk.size());
        for (PageRequest page : chunk) {
            futures.add(executor.submit(LogContext.propagate(() -> fetchPage(resourceName, url, page, options))));
        }

        List<List<JsonNode>> results = new ArrayList<>(chunk.size());
        RuntimeException failure = null;
        try (CancellationToken.Registration ignored = token.onCancel(() -> futures.forEach(f -> f.cancel(true)))) {
            for (Future<List<JsonNode>> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = unwrap(e, url);
                    }
                } catch (CancellationException e) {
                    if (failure == null) {
                        failure = new CancelledException("Fetch of " + resourceName + " was cancelled", e);
                    }
                } catch (InterruptedException e) {
                    futures.forEach(f -> f.cancel(true));
                    Thread.currentThread().interrupt();
                    throw new CancelledException("Interrupted while fetching " + resourceName, e);
                }
            }
        }

        if (token.isCancelled()) {
            throw new CancelledException("Fetch of " + resourceName + " was cancelled");
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    private List<JsonNode> fetchPage(String resourceName, String url, PageRequest page, FetchOptions options) {
        long startNanos = System.nanoTime();
        try (Span span = tracingService.startSpan(TracingService.PAGE,
                Map.of("resource", resourceName, "offset", String.valueOf(page.offset())))) {
            try {
                HttpResult response = transport.execute(HttpCall.get(url, page.params(), options.getRequestTimeout()));
                List<JsonNode> entities = QueryEnvelope.of(classifier.classifyQuery(response)).entities();
                span.setAttribute("records", entities.size());
                span.setStatus(Span.SpanStatus.OK);
                log.debug("Page {} (offset {}) of {} returned {} records",
                        page.index(), page.offset(), resourceName, entities.size());
                return entities;
            } catch (RuntimeException e) {
                span.fail(e);
                log.debug("Page {} (offset {}) of {} failed: {}", page.index(), page.offset(), resourceName, e.getMessage());
                throw e;
            } finally {
                metricsService.recordPageDuration(resourceName, Duration.ofNanos(System.nanoTime() - startNanos));
            }
        }
    }

    private static RuntimeException unwrap(ExecutionException e, String url) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return RequestException.transport(url, cause);
    }
}
