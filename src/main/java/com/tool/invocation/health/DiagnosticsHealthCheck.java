package com.tool.invocation.health;

import com.tool.invocation.diagnostics.DiagnosticRecord;
import com.tool.invocation.diagnostics.DiagnosticsStore;
import com.tool.invocation.diagnostics.RingBuffer;

/**
 * Reports the diagnostics buffers. DEGRADED once the error buffer has evicted records,
 * since older failures are no longer inspectable through {@code get_recent_errors}.
 */
public class DiagnosticsHealthCheck implements HealthCheck {

    private final DiagnosticsStore store;

    public DiagnosticsHealthCheck(DiagnosticsStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "diagnostics";
    }

    @Override
    public HealthStatus check() {
        RingBuffer<DiagnosticRecord> errors = store.errors();
        HealthStatus base = errors.dropped() > 0
                ? HealthStatus.degraded(errors.dropped() + " error records dropped")
                : HealthStatus.up("OK");
        return base.withDetail("buffers", store.stats());
    }
}
