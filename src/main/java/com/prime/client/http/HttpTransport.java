package com.prime.client.http;

/**
 * Executes HTTP calls against the API on behalf of the client.
 *
 * <p>Implementations must be thread-safe: page requests of one chunk run
 * concurrently over the same transport. A call that produces no response
 * (I/O error, timeout) raises {@link com.prime.client.error.RequestException};
 * an interrupted call raises {@link com.prime.client.error.CancelledException}.
 * Any response, whatever its status, is returned for classification.</p>
 */
public interface HttpTransport extends AutoCloseable {

    HttpResult execute(HttpCall call);

    @Override
    default void close() {
    }
}
