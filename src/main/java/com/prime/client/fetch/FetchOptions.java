package com.prime.client.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for a paginated bulk fetch.
 * Configures page size, chunk concurrency, pacing and caching.
 */
public class FetchOptions {

    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final Duration DEFAULT_HOLD_DURATION = Duration.ofSeconds(1);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(300);

    private final int pageSize;
    private final int concurrency;
    private final Duration holdDuration;
    private final Duration requestTimeout;
    private final boolean checkCache;
    private final ZeroCountPolicy zeroCountPolicy;

    private FetchOptions(Builder builder) {
        this.pageSize = builder.pageSize;
        this.concurrency = builder.concurrency;
        this.holdDuration = builder.holdDuration;
        this.requestTimeout = builder.requestTimeout;
        this.checkCache = builder.checkCache;
        this.zeroCountPolicy = builder.zeroCountPolicy;
    }

    /**
     * Number of records requested per page.
     */
    public int getPageSize() {
        return pageSize;
    }

    /**
     * Maximum number of page requests in flight at once (the chunk size).
     */
    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Pause inserted after each chunk of page requests.
     */
    public Duration getHoldDuration() {
        return holdDuration;
    }

    /**
     * Timeout of each individual HTTP request.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public boolean isCheckCache() {
        return checkCache;
    }

    public ZeroCountPolicy getZeroCountPolicy() {
        return zeroCountPolicy;
    }

    /**
     * Creates default options.
     */
    public static FetchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with these options.
     */
    public Builder toBuilder() {
        return new Builder()
                .pageSize(pageSize)
                .concurrency(concurrency)
                .holdDuration(holdDuration)
                .requestTimeout(requestTimeout)
                .checkCache(checkCache)
                .zeroCountPolicy(zeroCountPolicy);
    }

    @Override
    public String toString() {
        return "FetchOptions{pageSize=" + pageSize + ", concurrency=" + concurrency
                + ", holdDuration=" + holdDuration + ", requestTimeout=" + requestTimeout
                + ", checkCache=" + checkCache + ", zeroCountPolicy=" + zeroCountPolicy + "}";
    }

    public static class Builder {
        private int pageSize = DEFAULT_PAGE_SIZE;
        private int concurrency = DEFAULT_CONCURRENCY;
        private Duration holdDuration = DEFAULT_HOLD_DURATION;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private boolean checkCache = true;
        private ZeroCountPolicy zeroCountPolicy = ZeroCountPolicy.FAIL;

        public Builder pageSize(int pageSize) {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive");
            }
            this.pageSize = pageSize;
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency <= 0) {
                throw new IllegalArgumentException("concurrency must be positive");
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder holdDuration(Duration holdDuration) {
            Objects.requireNonNull(holdDuration, "holdDuration is required");
            if (holdDuration.isNegative()) {
                throw new IllegalArgumentException("holdDuration must not be negative");
            }
            this.holdDuration = holdDuration;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            Objects.requireNonNull(requestTimeout, "requestTimeout is required");
            if (requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder checkCache(boolean checkCache) {
            this.checkCache = checkCache;
            return this;
        }

        public Builder zeroCountPolicy(ZeroCountPolicy zeroCountPolicy) {
            this.zeroCountPolicy = Objects.requireNonNull(zeroCountPolicy, "zeroCountPolicy is required");
            return this;
        }

        public FetchOptions build() {
            return new FetchOptions(this);
        }
    }
}
