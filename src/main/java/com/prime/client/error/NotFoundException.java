package com.prime.client.error;

/**
 * The requested URL does not exist on the server (HTTP 404).
 */
public class NotFoundException extends PrimeApiException {

    public NotFoundException(String message, String url) {
        super(message, url, 404, null, null);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
