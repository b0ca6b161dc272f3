package com.prime.client.error;

/**
 * The caller referenced a resource name the API catalog does not know.
 */
public class ResourceNotFoundException extends PrimeApiException {

    public ResourceNotFoundException(String message, String resourceName) {
        super(message, null, 0, resourceName, null);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.RESOURCE_NOT_FOUND;
    }
}
