package com.prime.client.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prime.client.error.AuthException;
import com.prime.client.http.FakePrimeApi;
import com.prime.client.http.ResponseClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCatalogTest {

    private FakePrimeApi api;
    private ResourceCatalog catalog;

    @BeforeEach
    void setUp() {
        api = new FakePrimeApi()
                .withData("Devices", 10)
                .withData("Alarms", 5)
                .withService("deleteDevices", "PUT")
                .withService("jobSummary", "get");
        catalog = new ResourceCatalog(api, new ResponseClassifier(new ObjectMapper()),
                FakePrimeApi.API_URL, Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Discovery")
    class Discovery {

        @Test
        @DisplayName("Listings are fetched lazily and only once")
        void lazySingleLoad() {
            assertFalse(catalog.isLoaded());
            assertTrue(api.calls().isEmpty());

            catalog.dataResourceNames();
            catalog.dataResourceNames();
            catalog.findData("Devices");
            catalog.serviceResourceNames();
            catalog.findService("jobSummary");

            assertTrue(catalog.isLoaded());
            assertEquals(1, api.callsTo(FakePrimeApi.API_URL + "data.json").size());
            assertEquals(1, api.callsTo(FakePrimeApi.API_URL + "op.json").size());
        }

        @Test
        @DisplayName("Concurrent first accesses perform a single discovery call")
        void concurrentFirstAccess() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Set<String>>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return catalog.dataResourceNames();
                    }));
                }
                start.countDown();
                for (Future<Set<String>> future : futures) {
                    assertEquals(Set.of("Devices", "Alarms"), future.get());
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, api.callsTo(FakePrimeApi.API_URL + "data.json").size());
        }

        @Test
        @DisplayName("Failed discovery propagates and is retried on next access")
        void failureRetried() {
            api.catalogStatus(401);

            assertThrows(AuthException.class, () -> catalog.dataResourceNames());
            assertFalse(catalog.isLoaded());

            api.catalogStatus(200);

            assertEquals(Set.of("Devices", "Alarms"), catalog.dataResourceNames());
            assertEquals(2, api.callsTo(FakePrimeApi.API_URL + "data.json").size());
        }
    }

    @Nested
    @DisplayName("Descriptors")
    class Descriptors {

        @Test
        @DisplayName("Data resources resolve to absolute URLs")
        void dataDescriptor() {
            ResourceDescriptor devices = catalog.findData("Devices").orElseThrow();

            assertEquals(ResourceKind.DATA, devices.kind());
            assertEquals(FakePrimeApi.dataUrl("Devices"), devices.url());
            assertEquals("GET", devices.method());
        }

        @Test
        @DisplayName("Service resources keep their method, upper-cased")
        void serviceDescriptor() {
            ResourceDescriptor jobs = catalog.findService("jobSummary").orElseThrow();

            assertEquals(ResourceKind.SERVICE, jobs.kind());
            assertEquals(FakePrimeApi.serviceUrl("jobSummary"), jobs.url());
            assertEquals("GET", jobs.method());
            assertEquals("PUT", catalog.findService("deleteDevices").orElseThrow().method());
        }

        @Test
        @DisplayName("Unknown names are empty")
        void unknown() {
            assertTrue(catalog.findData("Nope").isEmpty());
            assertTrue(catalog.findService("Devices").isEmpty());
        }

        @Test
        @DisplayName("Names keep listing order")
        void listingOrder() {
            assertEquals(List.of("Devices", "Alarms"), new ArrayList<>(catalog.dataResourceNames()));
        }
    }
}
