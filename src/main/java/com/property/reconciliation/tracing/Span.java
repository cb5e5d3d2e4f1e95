package com.property.reconciliation.tracing;

/**
 * A unit of work in a trace. Closing the span ends it, so spans are opened
 * in try-with-resources blocks around a batch or a chunk.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void addEvent(String name);

    void markFailed(Throwable cause);

    @Override
    void close();
}
