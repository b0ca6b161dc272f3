package com.prime.client.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FetchOptionsTest {

    @Test
    @DisplayName("Defaults match the API's rate limiting guidance")
    void defaults() {
        FetchOptions options = FetchOptions.defaults();

        assertEquals(1000, options.getPageSize());
        assertEquals(5, options.getConcurrency());
        assertEquals(Duration.ofSeconds(1), options.getHoldDuration());
        assertEquals(Duration.ofSeconds(300), options.getRequestTimeout());
        assertTrue(options.isCheckCache());
        assertEquals(ZeroCountPolicy.FAIL, options.getZeroCountPolicy());
    }

    @Test
    @DisplayName("toBuilder keeps every setting")
    void toBuilderCopies() {
        FetchOptions original = FetchOptions.builder()
                .pageSize(200)
                .concurrency(2)
                .holdDuration(Duration.ZERO)
                .requestTimeout(Duration.ofSeconds(5))
                .checkCache(false)
                .zeroCountPolicy(ZeroCountPolicy.EMPTY)
                .build();

        FetchOptions copy = original.toBuilder().build();

        assertEquals(original.toString(), copy.toString());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> FetchOptions.builder().pageSize(0));
        assertThrows(IllegalArgumentException.class, () -> FetchOptions.builder().concurrency(-1));
        assertThrows(IllegalArgumentException.class, () -> FetchOptions.builder().holdDuration(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> FetchOptions.builder().requestTimeout(Duration.ZERO));
        assertThrows(NullPointerException.class, () -> FetchOptions.builder().zeroCountPolicy(null));
    }
}
