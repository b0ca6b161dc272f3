package com.prime.client.error;

/**
 * Malformed request, unsupported content type, unknown status code or a
 * transport failure (I/O error, request timeout).
 */
public class RequestException extends PrimeApiException {

    private final boolean timeout;

    public RequestException(String message, String url, int statusCode) {
        super(message, url, statusCode, null, null);
        this.timeout = false;
    }

    private RequestException(String message, String url, boolean timeout, Throwable cause) {
        super(message, url, 0, null, cause);
        this.timeout = timeout;
    }

    /**
     * A request that never produced a response.
     */
    public static RequestException transport(String url, Throwable cause) {
        return new RequestException("Request to " + url + " failed: " + cause.getMessage(), url, false, cause);
    }

    /**
     * A request whose own timeout expired before the response arrived.
     */
    public static RequestException timedOut(String url, Throwable cause) {
        return new RequestException("Request to " + url + " timed out", url, true, cause);
    }

    /**
     * A URL the HTTP client refuses, e.g. an unexpanded catalog template.
     */
    public static RequestException malformedUrl(String url, Throwable cause) {
        return new RequestException("Invalid request URL " + url + ": " + cause.getMessage(), url, false, cause);
    }

    public boolean isTimeout() {
        return timeout;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.REQUEST;
    }
}
