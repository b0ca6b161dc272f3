package com.prime.client.error;

/**
 * Base class of every failure raised by the client.
 *
 * <p>Carries the {@link ErrorCategory} plus whatever request context was known
 * when the failure happened (URL, HTTP status, resource name), so callers can
 * diagnose a failure without digging into the client internals.</p>
 */
public abstract class PrimeApiException extends RuntimeException {

    private final String url;
    private final int statusCode;
    private volatile String resourceName;

    protected PrimeApiException(String message, String url, int statusCode, String resourceName, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
        this.resourceName = resourceName;
    }

    public abstract ErrorCategory getCategory();

    /**
     * The request URL, or null when the failure is not tied to a request.
     */
    public String getUrl() {
        return url;
    }

    /**
     * The HTTP status code, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * Records the resource this failure belongs to. Has no effect once a
     * resource name is set, like {@link Throwable#initCause(Throwable)}.
     *
     * @return this exception
     */
    public PrimeApiException initResourceName(String resourceName) {
        if (this.resourceName == null) {
            this.resourceName = resourceName;
        }
        return this;
    }
}
