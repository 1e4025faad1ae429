package com.tool.invocation.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time copy of all counters, keyed by tool name and dependency name.
 */
public record MetricsSnapshot(Map<String, ToolCounters> tools, Map<String, UpstreamCounters> upstream) {

    public MetricsSnapshot {
        tools = Collections.unmodifiableMap(new TreeMap<>(tools));
        upstream = Collections.unmodifiableMap(new TreeMap<>(upstream));
    }

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(Map.of(), Map.of());
    }

    public ToolCounters tool(String name) {
        return tools.getOrDefault(name, ToolCounters.ZERO);
    }

    public UpstreamCounters dependency(String name) {
        return upstream.getOrDefault(name, UpstreamCounters.ZERO);
    }

    /**
     * JSON-friendly form returned by {@code get_metrics}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> toolMaps = new LinkedHashMap<>();
        tools.forEach((name, c) -> toolMaps.put(name, c.toMap()));
        Map<String, Object> upstreamMaps = new LinkedHashMap<>();
        upstream.forEach((name, c) -> upstreamMaps.put(name, c.toMap()));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tools", toolMaps);
        out.put("upstream", upstreamMaps);
        return out;
    }

    public record ToolCounters(long callsTotal, long errorsTotal, long mutatingCallsTotal, long latencySumMs) {

        static final ToolCounters ZERO = new ToolCounters(0, 0, 0, 0);

        public Map<String, Object> toMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("calls_total", callsTotal);
            out.put("errors_total", errorsTotal);
            out.put("mutating_calls_total", mutatingCallsTotal);
            out.put("latency_sum_ms", latencySumMs);
            return out;
        }
    }

    public record UpstreamCounters(long requestsTotal, long errorsTotal, long rateLimitedTotal, long timeoutsTotal) {

        static final UpstreamCounters ZERO = new UpstreamCounters(0, 0, 0, 0);

        public Map<String, Object> toMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("requests_total", requestsTotal);
            out.put("errors_total", errorsTotal);
            out.put("rate_limited_total", rateLimitedTotal);
            out.put("timeouts_total", timeoutsTotal);
            return out;
        }
    }
}
