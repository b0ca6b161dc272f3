package com.prime.client.fetch;

import com.prime.client.error.CancelledException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned switch that aborts a running fetch.
 *
 * <p>Cancelling wakes a fetch from its hold pause, interrupts the page requests
 * of the chunk in flight and prevents later chunks from starting; the fetch then
 * fails with {@link CancelledException}. A token can be cancelled once and stays
 * cancelled.</p>
 *
 * <pre>
 * CancellationToken token = new CancellationToken();
 * executor.submit(() -> client.requestData("Devices", params, options, token));
 * ...
 * token.cancel();
 * </pre>
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * A fresh token nobody holds a reference to, so it is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            cancelled.countDown();
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Throws {@link CancelledException} if the token was cancelled.
     */
    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new CancelledException(operation + " was cancelled");
        }
    }

    /**
     * Registers a callback run on cancellation, immediately if already cancelled.
     * Closing the returned registration removes the callback.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (!isCancelled()) {
                listeners.add(listener);
                return () -> listeners.remove(listener);
            }
        }
        listener.run();
        return () -> { };
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the token was cancelled before the timeout elapsed
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
