package com.prime.client.error;

/**
 * Bad credentials, unauthorized or forbidden access.
 */
public class AuthException extends PrimeApiException {

    public AuthException(String message, String url, int statusCode) {
        super(message, url, statusCode, null, null);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.AUTH;
    }
}
