package com.prime.client.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prime.client.catalog.ResourceDescriptor;
import com.prime.client.catalog.ResourceKind;
import com.prime.client.error.PrimeApiException;
import com.prime.client.http.HttpCall;
import com.prime.client.http.HttpTransport;
import com.prime.client.http.ResponseClassifier;
import com.prime.client.metrics.MetricsService;
import com.prime.client.metrics.NoOpMetricsService;
import com.prime.client.tracing.NoOpTracingService;
import com.prime.client.tracing.Span;
import com.prime.client.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Invokes a service resource with a single HTTP call, using the method the
 * catalog recorded for it.
 *
 * <p>Parameters travel as the query string for GET, as a JSON body for POST
 * and PUT, and as a form-encoded body for any other method. The response goes
 * through the same classification as data queries, without the zero-count
 * check.</p>
 */
public class ServiceInvoker {
    private static final Logger log = LoggerFactory.getLogger(ServiceInvoker.class);

    private final HttpTransport transport;
    private final ResponseClassifier classifier;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public ServiceInvoker(HttpTransport transport, ResponseClassifier classifier, ObjectMapper objectMapper) {
        this(transport, classifier, objectMapper, new NoOpMetricsService(), new NoOpTracingService());
    }

    public ServiceInvoker(HttpTransport transport, ResponseClassifier classifier, ObjectMapper objectMapper,
                          MetricsService metricsService, TracingService tracingService) {
        this.transport = transport;
        this.classifier = classifier;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Calls the service and returns its decoded response body.
     *
     * @throws IllegalArgumentException if the descriptor is not a service resource
     * @throws PrimeApiException        if the call fails or is classified as an error
     */
    public JsonNode invoke(ResourceDescriptor service, Map<String, ?> params, Duration timeout) {
        if (service.kind() != ResourceKind.SERVICE) {
            throw new IllegalArgumentException("'" + service.name() + "' is not a service resource");
        }
        try (Span span = tracingService.startSpan(TracingService.SERVICE,
                Map.of("resource", service.name(), "method", service.method()))) {
            try {
                HttpCall call = buildCall(service, params, timeout);
                log.debug("Invoking service {} ({} {})", service.name(), service.method(), service.url());
                JsonNode response = classifier.classify(transport.execute(call));
                span.setStatus(Span.SpanStatus.OK);
                return response;
            } catch (PrimeApiException e) {
                e.initResourceName(service.name());
                span.fail(e);
                metricsService.incrementErrors(e.getCategory());
                throw e;
            }
        }
    }

    HttpCall buildCall(ResourceDescriptor service, Map<String, ?> params, Duration timeout) {
        Map<String, ?> payload = params != null ? params : Map.of();
        return switch (service.method()) {
            case "GET" -> HttpCall.get(service.url(), payload, timeout);
            case "POST", "PUT" -> HttpCall.json(service.method(), service.url(), toJson(payload), timeout);
            default -> HttpCall.form(service.method(), service.url(), payload, timeout);
        };
    }

    private String toJson(Map<String, ?> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Service payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
