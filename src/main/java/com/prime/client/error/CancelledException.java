package com.prime.client.error;

/**
 * The caller aborted the operation, or the calling thread was interrupted.
 */
public class CancelledException extends PrimeApiException {

    public CancelledException(String message) {
        super(message, null, 0, null, null);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, null, 0, null, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CANCELLED;
    }
}
