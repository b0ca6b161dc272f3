package com.prime.client.fetch;

import com.prime.client.error.CancelledException;

import java.time.Duration;

/**
 * Performs the hold pause between chunks of page requests.
 * The pause is wall-clock time; it ends early only on cancellation.
 */
@FunctionalInterface
public interface HoldTimer {

    /**
     * Pauses for {@code duration}.
     *
     * @throws CancelledException if the token is cancelled or the thread
     *                            interrupted before the pause ends
     */
    void hold(Duration duration, CancellationToken token);

    /**
     * The default timer: blocks the calling thread, waking early on cancellation.
     */
    static HoldTimer sleeping() {
        return (duration, token) -> {
            if (duration.isZero()) {
                token.throwIfCancelled("Fetch");
                return;
            }
            try {
                if (token.awaitCancellation(duration)) {
                    throw new CancelledException("Fetch was cancelled during hold pause");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancelledException("Interrupted during hold pause", e);
            }
        };
    }
}
