package com.prime.client.error;

/**
 * A data query matched zero records.
 */
public class NoResultException extends PrimeApiException {

    public NoResultException(String message, String url, String resourceName) {
        super(message, url, 200, resourceName, null);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NO_RESULT;
    }
}
