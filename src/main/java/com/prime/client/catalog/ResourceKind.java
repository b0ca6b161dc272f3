package com.prime.client.catalog;

/**
 * The two kinds of resource exposed by the API.
 */
public enum ResourceKind {
    /** Paginated, read-only records. */
    DATA,
    /** Single-call action, not paginated. */
    SERVICE
}
