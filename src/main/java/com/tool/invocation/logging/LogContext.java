package com.tool.invocation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forToolCall(callId, "create_issue", true)) {
 *     log.info("tool.call.ok durationMs={}", durationMs);
 * }
 * </pre>
 *
 * <p>Dispatch hops between threads, so a context is opened around each step that logs rather
 * than once per call.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String CALL_ID = "callId";
    public static final String TOOL = "tool";
    public static final String OPERATION = "operation";
    public static final String MUTATING = "mutating";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forToolCall(String callId, String toolName, boolean mutating) {
        LogContext ctx = new LogContext();
        ctx.put(CALL_ID, callId);
        ctx.put(TOOL, toolName);
        ctx.put(MUTATING, Boolean.toString(mutating));
        ctx.put(OPERATION, "tool_call");
        return ctx;
    }

    /**
     * Context for work outside a single call, e.g. authorization changes or schema republishing.
     */
    public static LogContext forOperation(String operation) {
        LogContext ctx = new LogContext();
        ctx.put(OPERATION, operation);
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
