package com.tool.invocation.tracing;

import java.util.Map;

/**
 * No-op implementation of {@link TracingService}.
 */
public class NoOpTracingService implements TracingService {

    private static final CallSpan NO_OP_SPAN = new NoOpSpan();

    @Override
    public CallSpan startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements CallSpan {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void addEvent(String name) {
        }

        @Override
        public void close() {
        }
    }
}
