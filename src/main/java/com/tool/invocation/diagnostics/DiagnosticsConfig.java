package com.tool.invocation.diagnostics;

/**
 * Capacities of the three diagnostics buffers. A capacity of zero or less means unbounded.
 *
 * @param eventsCapacity capacity of the call-event buffer
 * @param logsCapacity   capacity of the log-line buffer
 * @param errorsCapacity capacity of the error buffer
 */
public record DiagnosticsConfig(int eventsCapacity, int logsCapacity, int errorsCapacity) {

    /**
     * Default capacities: 2,000 events, 2,000 log lines, 500 errors.
     */
    public static DiagnosticsConfig defaults() {
        return new DiagnosticsConfig(2_000, 2_000, 500);
    }

    /**
     * Same capacity for all three buffers.
     */
    public static DiagnosticsConfig uniform(int capacity) {
        return new DiagnosticsConfig(capacity, capacity, capacity);
    }
}
