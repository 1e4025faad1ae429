package com.tool.invocation.diagnostics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory store of recent call events, log lines and errors, each in its own
 * {@link RingBuffer}. Every record is redacted before it is stored.
 *
 * <p>Used by the dispatcher to record call outcomes and by the introspection tools
 * ({@code get_recent_events}, {@code get_recent_errors}, {@code get_recent_logs}).</p>
 */
public class DiagnosticsStore {

    private final RingBuffer<DiagnosticRecord> events;
    private final RingBuffer<DiagnosticRecord> logs;
    private final RingBuffer<DiagnosticRecord> errors;

    public DiagnosticsStore() {
        this(DiagnosticsConfig.defaults());
    }

    public DiagnosticsStore(DiagnosticsConfig config) {
        this.events = new RingBuffer<>(config.eventsCapacity());
        this.logs = new RingBuffer<>(config.logsCapacity());
        this.errors = new RingBuffer<>(config.errorsCapacity());
    }

    /**
     * Routes a record to the buffer matching its kind.
     */
    public void append(DiagnosticRecord record) {
        DiagnosticRecord safe = record.redacted();
        switch (safe.kind()) {
            case EVENT -> events.append(safe);
            case LOG -> logs.append(safe);
            case ERROR -> errors.append(safe);
        }
    }

    public List<DiagnosticRecord> recentEvents(int limit) {
        return events.snapshot(limit);
    }

    public List<DiagnosticRecord> recentLogs(int limit) {
        return logs.snapshot(limit);
    }

    public List<DiagnosticRecord> recentErrors(int limit) {
        return errors.snapshot(limit);
    }

    public RingBuffer<DiagnosticRecord> events() {
        return events;
    }

    public RingBuffer<DiagnosticRecord> logs() {
        return logs;
    }

    public RingBuffer<DiagnosticRecord> errors() {
        return errors;
    }

    /**
     * Buffer sizes, totals and eviction counters, keyed by buffer name.
     */
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("events", bufferStats(events));
        out.put("logs", bufferStats(logs));
        out.put("errors", bufferStats(errors));
        return out;
    }

    private static Map<String, Object> bufferStats(RingBuffer<?> buffer) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("size", buffer.size());
        out.put("capacity", buffer.isBounded() ? buffer.capacity() : 0);
        out.put("total", buffer.total());
        out.put("dropped", buffer.dropped());
        return out;
    }
}
