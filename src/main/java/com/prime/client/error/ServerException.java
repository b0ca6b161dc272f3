package com.prime.client.error;

/**
 * Internal server error, maintenance or overload.
 */
public class ServerException extends PrimeApiException {

    public ServerException(String message, String url, int statusCode) {
        super(message, url, statusCode, null, null);
    }

    /**
     * Whether the server reported a condition that may clear on its own
     * (down for upgrade, overloaded / rate limited). Retrying is up to the caller.
     */
    public boolean isTransient() {
        return getStatusCode() == 502 || getStatusCode() == 503;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.SERVER;
    }
}
