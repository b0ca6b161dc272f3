package com.prime.client.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prime.client.cache.CacheConfig;
import com.prime.client.error.ErrorCategory;
import com.prime.client.error.NoResultException;
import com.prime.client.error.ResourceNotFoundException;
import com.prime.client.error.ServerException;
import com.prime.client.fetch.FetchOptions;
import com.prime.client.fetch.FetchResult;
import com.prime.client.fetch.PageRequest;
import com.prime.client.fetch.ZeroCountPolicy;
import com.prime.client.health.HealthStatus;
import com.prime.client.http.FakePrimeApi;
import com.prime.client.http.HttpCall;
import com.prime.client.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PrimeClientTest {

    private FakePrimeApi api;
    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private PrimeClient client;

    @BeforeEach
    void setUp() {
        api = new FakePrimeApi()
                .withData("Devices", 2500)
                .withData("Alarms", 3)
                .withData("Empty", 0)
                .withService("runJob", "POST")
                .withService("jobSummary", "GET");
        executor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        client = newClient(ClientConfig.builder().baseUrl(FakePrimeApi.BASE_URL).build());
    }

    @AfterEach
    void tearDown() {
        client.close();
        executor.shutdownNow();
    }

    private PrimeClient newClient(ClientConfig config) {
        return PrimeClient.builder()
                .config(config)
                .transport(api)
                .executor(executor)
                .holdTimer((duration, token) -> { })
                .metricsService(new MicrometerMetricsService(registry))
                .build();
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("Data resource returns every record in offset order")
        void dataResource() {
            JsonNode records = client.request("Devices", Map.of());

            assertTrue(records.isArray());
            assertEquals(2500, records.size());
            for (int i = 0; i < records.size(); i++) {
                assertEquals(i, records.get(i).get("@id").asInt());
            }
            assertEquals(3, api.pageCalls().size());
        }

        @Test
        @DisplayName("Service resource returns the response body")
        void serviceResource() {
            JsonNode response = client.request("runJob", Map.of("jobName", "inventory"));

            assertEquals("runJob", response.path("mgmtResponse").path("service").asText());
            assertEquals("POST", response.path("mgmtResponse").path("method").asText());
            assertTrue(api.pageCalls().isEmpty());
        }

        @Test
        @DisplayName("Unknown name fails with ResourceNotFoundException naming the resource")
        void unknownResource() {
            ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                    () -> client.request("Unicorns", Map.of()));

            assertEquals("Unicorns", e.getResourceName());
            assertTrue(e.getMessage().contains("Unicorns"));
            assertEquals(ErrorCategory.RESOURCE_NOT_FOUND, e.getCategory());
            assertTrue(api.callsTo(FakePrimeApi.dataUrl("Unicorns")).isEmpty());
        }

        @Test
        @DisplayName("requestData rejects service names and requestService rejects data names")
        void kindSpecificEntryPoints() {
            assertThrows(ResourceNotFoundException.class, () -> client.requestData("runJob", Map.of()));
            assertThrows(ResourceNotFoundException.class, () -> client.requestService("Devices", Map.of()));
        }

        @Test
        @DisplayName("Resource names come from both listings, data first")
        void resourceNames() {
            assertEquals(Set.of("Devices", "Alarms", "Empty"), client.dataResources());
            assertEquals(Set.of("runJob", "jobSummary"), client.serviceResources());
            assertEquals(List.of("Devices", "Alarms", "Empty", "runJob", "jobSummary"),
                    List.copyOf(client.resources()));
        }

        @Test
        @DisplayName("Catalog is discovered once for the client's lifetime")
        void catalogDiscoveredOnce() {
            client.request("Alarms", Map.of());
            client.request("jobSummary", Map.of());
            client.request("Alarms", Map.of("x", 1));

            assertEquals(1, api.callsTo(FakePrimeApi.API_URL + "data.json").size());
            assertEquals(1, api.callsTo(FakePrimeApi.API_URL + "op.json").size());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Zero count fails before any page request")
        void zeroCount() {
            assertThrows(NoResultException.class, () -> client.requestData("Empty", Map.of()));
            assertTrue(api.pageCalls().isEmpty());
        }

        @Test
        @DisplayName("Zero count with EMPTY policy returns an empty result")
        void zeroCountEmpty() {
            FetchResult result = client.requestData("Empty", Map.of(),
                    FetchOptions.builder().zeroCountPolicy(ZeroCountPolicy.EMPTY).build());

            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("A failing page fails the whole fetch and nothing is cached")
        void pageFailureNotCached() {
            api.failPage(1000, 503);

            ServerException e = assertThrows(ServerException.class, () -> client.requestData("Devices", Map.of()));
            assertTrue(e.getMessage().contains("overloaded"));
            assertEquals("Devices", e.getResourceName());
            assertEquals(0, client.cacheStats().size());
            assertEquals(1.0, registry.get("prime.errors").tag("category", "SERVER").counter().count());
        }
    }

    @Nested
    @DisplayName("Cache")
    class Cache {

        @Test
        @DisplayName("Repeated fetch is served from the cache")
        void repeatedFetchCached() {
            FetchResult first = client.requestData("Alarms", Map.of("a", 1, "b", 2));
            api.resetCalls();

            Map<String, Object> reordered = new LinkedHashMap<>();
            reordered.put("b", 2);
            reordered.put("a", 1);
            FetchResult second = client.requestData("Alarms", reordered);

            assertEquals(first, second);
            assertTrue(api.calls().isEmpty());
            assertEquals(1, client.cacheStats().hitCount());
            assertEquals(1.0, registry.get("prime.cache.hit").counter().count());
        }

        @Test
        @DisplayName("checkCache=false refetches and refreshes the cached entry")
        void bypassRefreshes() {
            client.requestData("Alarms", Map.of());
            FetchResult refreshed = client.requestData("Alarms", Map.of(),
                    FetchOptions.builder().checkCache(false).build());
            api.resetCalls();

            FetchResult cached = client.requestData("Alarms", Map.of());

            assertEquals(refreshed, cached);
            assertTrue(api.calls().isEmpty());
        }

        @Test
        @DisplayName("Changes to returned records never reach the cached entry")
        void cachedRecordsIsolated() {
            FetchResult first = client.requestData("Alarms", Map.of());
            ((ObjectNode) first.entities().get(0)).put("@id", 999);

            FetchResult second = client.requestData("Alarms", Map.of());
            ((ObjectNode) second.entities().get(1)).put("@id", 998);
            FetchResult third = client.requestData("Alarms", Map.of());

            assertEquals(0, third.entities().get(0).get("@id").asInt());
            assertEquals(1, third.entities().get(1).get("@id").asInt());
            assertEquals(2, client.cacheStats().hitCount());
        }

        @Test
        @DisplayName("Generic request returns records detached from the cache")
        void requestArrayIsolated() {
            JsonNode records = client.request("Alarms", Map.of());
            ((ObjectNode) records.get(0)).put("@id", 999);

            assertEquals(0, client.request("Alarms", Map.of()).get(0).get("@id").asInt());
        }

        @Test
        @DisplayName("Different parameters are different cache entries")
        void differentParams() {
            client.requestData("Alarms", Map.of("a", 1));
            client.requestData("Alarms", Map.of("a", 2));

            assertEquals(2, client.cacheStats().size());
            assertEquals(2, api.callsTo(FakePrimeApi.dataUrl("Alarms")).stream()
                    .filter(c -> !c.queryParams().containsKey(PageRequest.FIRST_RESULT)).count());
        }

        @Test
        @DisplayName("invalidateCache forces a new fetch")
        void invalidate() {
            client.requestData("Alarms", Map.of());
            client.invalidateCache();
            api.resetCalls();

            client.requestData("Alarms", Map.of());

            assertFalse(api.calls().isEmpty());
        }

        @Test
        @DisplayName("Disabled cache fetches every time")
        void disabledCache() {
            PrimeClient uncached = newClient(ClientConfig.builder()
                    .baseUrl(FakePrimeApi.BASE_URL)
                    .cacheConfig(CacheConfig.disabled())
                    .build());

            uncached.requestData("Alarms", Map.of());
            api.resetCalls();
            uncached.requestData("Alarms", Map.of());

            assertEquals(1, api.pageCalls().size());
            uncached.close();
        }
    }

    @Nested
    @DisplayName("Scope filter")
    class ScopeFilter {

        @Test
        @DisplayName("Configured virtual domain is sent with every query")
        void configuredDomain() {
            PrimeClient scoped = newClient(ClientConfig.builder()
                    .baseUrl(FakePrimeApi.BASE_URL)
                    .virtualDomain("ROOT-DOMAIN")
                    .build());

            scoped.requestData("Alarms", Map.of());

            for (HttpCall call : api.callsTo(FakePrimeApi.dataUrl("Alarms"))) {
                assertEquals("ROOT-DOMAIN", call.queryParams().get("_ctx.domain"));
            }
            scoped.close();
        }

        @Test
        @DisplayName("Per-call scope overrides the default and is part of the cache identity")
        void perCallScope() {
            FetchOptions defaults = FetchOptions.defaults();
            client.requestData("Alarms", Map.of(), defaults, "Site-A", null);
            client.requestData("Alarms", Map.of(), defaults, "Site-B", null);

            assertEquals(2, client.cacheStats().size());
            assertTrue(api.pageCalls().stream().anyMatch(c -> "Site-B".equals(c.queryParams().get("_ctx.domain"))));
        }

        @Test
        @DisplayName("Caller parameters are never modified")
        void paramsUntouched() {
            Map<String, Object> params = new HashMap<>(Map.of("a", 1));

            client.request("Alarms", params, "Site-A");

            assertEquals(Map.of("a", 1), params);
        }

        @Test
        @DisplayName("Service calls carry the scope filter too")
        void serviceScoped() {
            client.requestService("jobSummary", Map.of(), "Site-A");

            HttpCall call = api.callsTo(FakePrimeApi.serviceUrl("jobSummary")).get(0);
            assertEquals("Site-A", call.queryParams().get("_ctx.domain"));
        }
    }

    @Test
    @DisplayName("Health is up against a healthy API")
    void health() {
        HealthStatus status = client.health();

        assertEquals(HealthStatus.Status.UP, status.status());
    }

    @Test
    @DisplayName("Builder requires a config")
    void builderRequiresConfig() {
        assertThrows(IllegalStateException.class, () -> PrimeClient.builder().build());
    }
}
