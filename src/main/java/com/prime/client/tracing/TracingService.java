package com.prime.client.tracing;

import java.util.Map;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the client runs
 * without any tracing dependency on the classpath.
 */
public interface TracingService {

    String FETCH = "prime.fetch";
    String PAGE = "prime.page";
    String SERVICE = "prime.service";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
