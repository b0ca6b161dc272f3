package com.prime.client.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.prime.client.http.HttpCall;
import com.prime.client.http.HttpTransport;
import com.prime.client.http.ResponseClassifier;
import com.prime.client.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-to-endpoint maps of the data and service resources the API exposes.
 *
 * <p>Each listing is fetched on first access and kept for the lifetime of the
 * catalog; later accesses never touch the network. Loading is idempotent and
 * safe to race: concurrent first accesses perform a single discovery call.
 * A failed discovery leaves the listing unloaded so the next access retries,
 * and the failure propagates unchanged from the response classifier.</p>
 */
public class ResourceCatalog {
    private static final Logger log = LoggerFactory.getLogger(ResourceCatalog.class);

    static final String DATA_LISTING = "data.json";
    static final String SERVICE_LISTING = "op.json";

    private final HttpTransport transport;
    private final ResponseClassifier classifier;
    private final CatalogParser parser;
    private final String baseUrl;
    private final Duration timeout;

    private volatile Map<String, ResourceDescriptor> dataResources;
    private volatile Map<String, ResourceDescriptor> serviceResources;

    public ResourceCatalog(HttpTransport transport, ResponseClassifier classifier, String baseUrl, Duration timeout) {
        this.transport = transport;
        this.classifier = classifier;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.parser = new CatalogParser(this.baseUrl);
        this.timeout = timeout;
    }

    public Set<String> dataResourceNames() {
        return ensureDataLoaded().keySet();
    }

    public Set<String> serviceResourceNames() {
        return ensureServicesLoaded().keySet();
    }

    public Optional<ResourceDescriptor> findData(String name) {
        return Optional.ofNullable(ensureDataLoaded().get(name));
    }

    public Optional<ResourceDescriptor> findService(String name) {
        return Optional.ofNullable(ensureServicesLoaded().get(name));
    }

    /**
     * Loads both listings if they are not loaded yet.
     */
    public void ensureLoaded() {
        ensureDataLoaded();
        ensureServicesLoaded();
    }

    public boolean isLoaded() {
        return dataResources != null && serviceResources != null;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private Map<String, ResourceDescriptor> ensureDataLoaded() {
        Map<String, ResourceDescriptor> loaded = dataResources;
        if (loaded == null) {
            synchronized (this) {
                loaded = dataResources;
                if (loaded == null) {
                    loaded = index(parser.parseDataResources(discover(DATA_LISTING)));
                    dataResources = loaded;
                    log.info("Loaded {} data resources from {}", loaded.size(), baseUrl + DATA_LISTING);
                }
            }
        }
        return loaded;
    }

    private Map<String, ResourceDescriptor> ensureServicesLoaded() {
        Map<String, ResourceDescriptor> loaded = serviceResources;
        if (loaded == null) {
            synchronized (this) {
                loaded = serviceResources;
                if (loaded == null) {
                    loaded = index(parser.parseServiceResources(discover(SERVICE_LISTING)));
                    serviceResources = loaded;
                    log.info("Loaded {} service resources from {}", loaded.size(), baseUrl + SERVICE_LISTING);
                }
            }
        }
        return loaded;
    }

    private JsonNode discover(String listing) {
        try (LogContext ctx = LogContext.forCatalog(listing)) {
            return classifier.classify(transport.execute(HttpCall.get(baseUrl + listing, Map.of(), timeout)));
        }
    }

    private static Map<String, ResourceDescriptor> index(List<ResourceDescriptor> resources) {
        Map<String, ResourceDescriptor> byName = new LinkedHashMap<>();
        for (ResourceDescriptor resource : resources) {
            ResourceDescriptor previous = byName.putIfAbsent(resource.name(), resource);
            if (previous != null) {
                log.warn("Duplicate {} resource '{}' in catalog, keeping {}",
                        resource.kind(), resource.name(), previous.url());
            }
        }
        return Collections.unmodifiableMap(byName);
    }
}
