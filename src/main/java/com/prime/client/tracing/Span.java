package com.prime.client.tracing;

/**
 * A traced unit of client work: a bulk fetch, one page request or a service call.
 * Ends when closed, so spans fit try-with-resources blocks.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(TracingService.FETCH, Map.of("resource", "Devices"))) {
 *     span.setAttribute("pages", 3L);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks the span failed and records the cause.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
