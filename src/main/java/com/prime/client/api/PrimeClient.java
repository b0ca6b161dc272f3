package com.prime.client.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.prime.client.cache.CacheStats;
import com.prime.client.cache.CaffeineFetchCache;
import com.prime.client.cache.FetchCache;
import com.prime.client.cache.Fingerprint;
import com.prime.client.cache.NoOpFetchCache;
import com.prime.client.catalog.ResourceCatalog;
import com.prime.client.catalog.ResourceDescriptor;
import com.prime.client.error.ResourceNotFoundException;
import com.prime.client.fetch.BatchFetcher;
import com.prime.client.fetch.CancellationToken;
import com.prime.client.fetch.FetchOptions;
import com.prime.client.fetch.FetchResult;
import com.prime.client.fetch.HoldTimer;
import com.prime.client.health.CatalogHealthCheck;
import com.prime.client.health.HealthCheckRegistry;
import com.prime.client.health.HealthStatus;
import com.prime.client.http.Credentials;
import com.prime.client.http.HttpTransport;
import com.prime.client.http.JdkHttpTransport;
import com.prime.client.http.ResponseClassifier;
import com.prime.client.logging.LogContext;
import com.prime.client.metrics.MetricsService;
import com.prime.client.metrics.NoOpMetricsService;
import com.prime.client.service.ServiceInvoker;
import com.prime.client.tracing.NoOpTracingService;
import com.prime.client.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point of the client library.
 *
 * <p>Routes a resource name to the paginated bulk fetch (data resources) or to
 * a single service call (service resources). Resource names come from the API
 * catalog, discovered on first use and kept for the life of the client.
 * Completed data fetches are memoized by a fingerprint of resource name and
 * parameters.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (PrimeClient client = PrimeClient.builder()
 *         .config(ClientConfig.builder()
 *                 .baseUrl("https://prime.example.com")
 *                 .credentials("admin", "secret")
 *                 .build())
 *         .build()) {
 *
 *     // All records of a data resource, 1000 per page, 5 pages at a time
 *     FetchResult devices = client.requestData("Devices", Map.of("reachability", "REACHABLE"));
 *
 *     // Tuned paging, bypassing the cache
 *     FetchResult clients = client.requestData("ClientDetails", Map.of(),
 *             FetchOptions.builder().pageSize(500).concurrency(2).checkCache(false).build());
 *
 *     // Service call
 *     JsonNode job = client.requestService("runJob", Map.of("jobName", "inventory"));
 * }
 * </pre>
 */
public class PrimeClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrimeClient.class);

    private final ClientConfig config;
    private final HttpTransport transport;
    private final boolean ownsTransport;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final ObjectMapper objectMapper;
    private final ResourceCatalog catalog;
    private final BatchFetcher fetcher;
    private final ServiceInvoker serviceInvoker;
    private final FetchCache cache;
    private final MetricsService metricsService;
    private final HealthCheckRegistry healthCheckRegistry;

    private PrimeClient(Builder builder) {
        this.config = builder.config;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.transport != null) {
            this.transport = builder.transport;
            this.ownsTransport = false;
        } else {
            this.transport = JdkHttpTransport.builder()
                    .credentials(config.hasCredentials()
                            ? new Credentials(config.getUsername(), config.getPassword()) : null)
                    .verifyTls(config.isVerifyTls())
                    .connectTimeout(config.getConnectTimeout())
                    .build();
            this.ownsTransport = true;
        }

        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newCachedThreadPool(new PageThreadFactory());
            this.ownsExecutor = true;
        }

        ResponseClassifier classifier = new ResponseClassifier(objectMapper, config.isClassifierZeroCountCheck());
        Duration timeout = config.getFetchOptions().getRequestTimeout();
        this.catalog = new ResourceCatalog(transport, classifier, config.getApiUrl(), timeout);
        this.fetcher = new BatchFetcher(transport, classifier, executor,
                builder.holdTimer, metricsService, tracingService);
        this.serviceInvoker = new ServiceInvoker(transport, classifier, objectMapper, metricsService, tracingService);

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (config.getCacheConfig().enabled()) {
            this.cache = new CaffeineFetchCache(config.getCacheConfig());
        } else {
            this.cache = new NoOpFetchCache();
        }

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new CatalogHealthCheck(transport, classifier,
                catalog.getBaseUrl() + "data.json", timeout, Duration.ofSeconds(5)));

        log.info("PrimeClient initialized for {}", config.getApiUrl());
    }

    // ========== Catalog ==========

    /**
     * Names of the data resources (paginated records) the API exposes.
     */
    public Set<String> dataResources() {
        return catalog.dataResourceNames();
    }

    /**
     * Names of the service resources (single-call actions) the API exposes.
     */
    public Set<String> serviceResources() {
        return catalog.serviceResourceNames();
    }

    /**
     * Names of every resource, data resources first.
     */
    public Set<String> resources() {
        Set<String> all = new LinkedHashSet<>(dataResources());
        all.addAll(serviceResources());
        return Collections.unmodifiableSet(all);
    }

    // ========== Generic request ==========

    /**
     * Requests a resource of either kind with the client's default options.
     *
     * @return for a data resource, an array of all its records in offset order;
     * for a service resource, the decoded response body
     * @throws ResourceNotFoundException if the name is neither a data nor a service resource
     */
    public JsonNode request(String resourceName, Map<String, ?> params) {
        return request(resourceName, params, null);
    }

    /**
     * Requests a resource of either kind, scoped to {@code scopeFilter}
     * (a virtual domain) when given.
     */
    public JsonNode request(String resourceName, Map<String, ?> params, String scopeFilter) {
        Optional<ResourceDescriptor> data = catalog.findData(resourceName);
        if (data.isPresent()) {
            FetchResult result = fetchData(data.get(), params, config.getFetchOptions(), scopeFilter,
                    CancellationToken.none());
            ArrayNode records = objectMapper.createArrayNode();
            records.addAll(result.entities());
            return records;
        }
        Optional<ResourceDescriptor> service = catalog.findService(resourceName);
        if (service.isPresent()) {
            return invokeService(service.get(), params, scopeFilter);
        }
        throw new ResourceNotFoundException("Resource '" + resourceName + "' not found in the API, check "
                + "dataResources() and serviceResources() for available resources", resourceName);
    }

    // ========== Data resources ==========

    public FetchResult requestData(String resourceName, Map<String, ?> params) {
        return requestData(resourceName, params, config.getFetchOptions());
    }

    public FetchResult requestData(String resourceName, Map<String, ?> params, FetchOptions options) {
        return requestData(resourceName, params, options, null, CancellationToken.none());
    }

    /**
     * Fetches every record of a data resource.
     *
     * @param resourceName a name from {@link #dataResources()}
     * @param params       filter / sort parameters, never modified
     * @param options      paging, pacing, timeout and cache settings
     * @param scopeFilter  virtual domain to scope the query to, or null for the configured default
     * @param token        aborts the fetch when cancelled
     * @throws ResourceNotFoundException if the name is not a data resource
     */
    public FetchResult requestData(String resourceName, Map<String, ?> params, FetchOptions options,
                                   String scopeFilter, CancellationToken token) {
        ResourceDescriptor resource = catalog.findData(resourceName)
                .orElseThrow(() -> new ResourceNotFoundException("Data resource '" + resourceName
                        + "' not found in the API, check dataResources() for available resources", resourceName));
        return fetchData(resource, params, options, scopeFilter, token);
    }

    // ========== Service resources ==========

    public JsonNode requestService(String resourceName, Map<String, ?> params) {
        return requestService(resourceName, params, null);
    }

    /**
     * Invokes a service resource with one HTTP call.
     *
     * @throws ResourceNotFoundException if the name is not a service resource
     */
    public JsonNode requestService(String resourceName, Map<String, ?> params, String scopeFilter) {
        ResourceDescriptor service = catalog.findService(resourceName)
                .orElseThrow(() -> new ResourceNotFoundException("Service resource '" + resourceName
                        + "' not found in the API, check serviceResources() for available services", resourceName));
        return invokeService(service, params, scopeFilter);
    }

    // ========== Cache and health ==========

    /**
     * Drops every memoized fetch.
     */
    public void invalidateCache() {
        cache.invalidateAll();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public ClientConfig getConfig() {
        return config;
    }

    private FetchResult fetchData(ResourceDescriptor resource, Map<String, ?> params, FetchOptions options,
                                  String scopeFilter, CancellationToken token) {
        Map<String, Object> effective = scoped(params, scopeFilter);
        Fingerprint fingerprint = Fingerprint.of(resource.name(), effective);

        try (LogContext ctx = LogContext.forFetch(LogContext.generateCorrelationId(), resource.name())) {
            if (options.isCheckCache()) {
                Optional<FetchResult> cached = cache.get(fingerprint);
                if (cached.isPresent()) {
                    metricsService.recordCacheHit();
                    log.debug("Cache hit for {} ({})", resource.name(), fingerprint);
                    return cached.get().deepCopy();
                }
                metricsService.recordCacheMiss();
            }

            log.info("Fetching {} with params {} ({})", resource.name(), effective, options);
            FetchResult result = fetcher.fetch(resource.name(), resource.url(), effective,
                    options, token != null ? token : CancellationToken.none());
            // the cache keeps its own records; callers may modify what they get
            cache.put(fingerprint, result.deepCopy());
            return result;
        }
    }

    private JsonNode invokeService(ResourceDescriptor service, Map<String, ?> params, String scopeFilter) {
        try (LogContext ctx = LogContext.forService(LogContext.generateCorrelationId(), service.name())) {
            return serviceInvoker.invoke(service, scoped(params, scopeFilter),
                    config.getFetchOptions().getRequestTimeout());
        }
    }

    /**
     * Copy of the caller's parameters with the scope filter added, if any.
     */
    Map<String, Object> scoped(Map<String, ?> params, String scopeFilter) {
        Map<String, Object> effective = new LinkedHashMap<>();
        if (params != null) {
            effective.putAll(params);
        }
        String scope = scopeFilter != null ? scopeFilter : config.getVirtualDomain();
        if (scope != null) {
            effective.put(config.getScopeFilterKey(), scope);
        }
        return effective;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (ownsTransport) {
            transport.close();
        }
        log.info("PrimeClient closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ClientConfig config;
        private HttpTransport transport;
        private ExecutorService executor;
        private ObjectMapper objectMapper;
        private FetchCache cache;
        private HoldTimer holdTimer;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder config(ClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Uses an existing transport instead of creating one from the config.
         * The transport is not closed with the client.
         */
        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Runs page requests on an existing executor, which is not shut down with the client.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Sets a custom fetch cache, overriding the config's cache settings.
         */
        public Builder cache(FetchCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder holdTimer(HoldTimer holdTimer) {
            this.holdTimer = holdTimer;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public PrimeClient build() {
            if (config == null) {
                throw new IllegalStateException("config is required");
            }
            return new PrimeClient(this);
        }
    }

    private static class PageThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "prime-page-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
