package com.prime.client.health;

import com.prime.client.error.PrimeApiException;
import com.prime.client.http.HttpCall;
import com.prime.client.http.HttpTransport;
import com.prime.client.http.ResponseClassifier;

import java.time.Duration;
import java.util.Map;

/**
 * Checks the API by requesting the data catalog listing and timing the answer.
 *
 * <p>UP when the listing is served within {@code slowThreshold}, DEGRADED when
 * it is served more slowly, DOWN with the error category when the request fails.
 * Runs against the live server every time; the client's cached catalog is not used.</p>
 */
public class CatalogHealthCheck implements HealthCheck {

    private final HttpTransport transport;
    private final ResponseClassifier classifier;
    private final String catalogUrl;
    private final Duration timeout;
    private final Duration slowThreshold;

    public CatalogHealthCheck(HttpTransport transport, ResponseClassifier classifier, String catalogUrl,
                              Duration timeout, Duration slowThreshold) {
        this.transport = transport;
        this.classifier = classifier;
        this.catalogUrl = catalogUrl;
        this.timeout = timeout;
        this.slowThreshold = slowThreshold;
    }

    @Override
    public String getName() {
        return "prime-api";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try {
            classifier.classify(transport.execute(HttpCall.get(catalogUrl, Map.of(), timeout)));
            long latencyMs = System.currentTimeMillis() - startMs;
            HealthStatus status = latencyMs > slowThreshold.toMillis()
                    ? HealthStatus.degraded("API responding slowly")
                    : HealthStatus.up("OK");
            return status.withDetail("latencyMs", latencyMs).withDetail("url", catalogUrl);
        } catch (PrimeApiException e) {
            return HealthStatus.down("API check failed: " + e.getMessage())
                    .withDetail("category", e.getCategory().name())
                    .withDetail("url", catalogUrl);
        }
    }
}
