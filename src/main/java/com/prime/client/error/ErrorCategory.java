package com.prime.client.error;

/**
 * Failure categories surfaced to callers of the client.
 */
public enum ErrorCategory {
    AUTH,
    REQUEST,
    SERVER,
    NOT_FOUND,
    NO_RESULT,
    RESOURCE_NOT_FOUND,
    CANCELLED
}
