package com.prime.client.fetch;

/**
 * What a fetch does when the count probe reports no records.
 */
public enum ZeroCountPolicy {
    /** Raise {@link com.prime.client.error.NoResultException}. */
    FAIL,
    /** Return an empty {@link FetchResult}. */
    EMPTY
}
