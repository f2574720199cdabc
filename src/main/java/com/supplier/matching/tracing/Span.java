package com.supplier.matching.tracing;

/**
 * A unit of work in a trace. Ends when closed, so spans fit try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("matching.score")) {
 *     span.setAttribute("pairs", pairs.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the exception and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
