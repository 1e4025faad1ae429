package com.tool.invocation.tracing;

/**
 * One traced tool call. Ending the span is done with {@link #close()}.
 */
public interface CallSpan extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Adds a named event; used to mark cancellation, which is not an error.
     */
    void addEvent(String name);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
