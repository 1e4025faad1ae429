package com.tool.invocation.metrics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters backed by {@link LongAdder}s. The default metrics implementation.
 */
public class InMemoryMetricsService implements MetricsService {

    private final Map<String, ToolBucket> tools = new ConcurrentHashMap<>();
    private final Map<String, UpstreamBucket> upstream = new ConcurrentHashMap<>();

    @Override
    public void recordToolCall(String toolName, boolean mutating, long durationMs, boolean errored) {
        ToolBucket bucket = tools.computeIfAbsent(toolName, k -> new ToolBucket());
        bucket.calls.increment();
        if (errored) {
            bucket.errors.increment();
        }
        if (mutating) {
            bucket.mutatingCalls.increment();
        }
        bucket.latencySumMs.add(Math.max(0, durationMs));
    }

    @Override
    public void recordUpstreamRequest(String dependency, boolean errored, boolean rateLimited, boolean timedOut) {
        UpstreamBucket bucket = upstream.computeIfAbsent(dependency, k -> new UpstreamBucket());
        bucket.requests.increment();
        if (errored) {
            bucket.errors.increment();
        }
        if (rateLimited) {
            bucket.rateLimited.increment();
        }
        if (timedOut) {
            bucket.timeouts.increment();
        }
    }

    @Override
    public MetricsSnapshot snapshot() {
        Map<String, MetricsSnapshot.ToolCounters> toolCounters = new LinkedHashMap<>();
        tools.forEach((name, b) -> toolCounters.put(name, new MetricsSnapshot.ToolCounters(
                b.calls.sum(), b.errors.sum(), b.mutatingCalls.sum(), b.latencySumMs.sum())));
        Map<String, MetricsSnapshot.UpstreamCounters> upstreamCounters = new LinkedHashMap<>();
        upstream.forEach((name, b) -> upstreamCounters.put(name, new MetricsSnapshot.UpstreamCounters(
                b.requests.sum(), b.errors.sum(), b.rateLimited.sum(), b.timeouts.sum())));
        return new MetricsSnapshot(toolCounters, upstreamCounters);
    }

    private static final class ToolBucket {
        final LongAdder calls = new LongAdder();
        final LongAdder errors = new LongAdder();
        final LongAdder mutatingCalls = new LongAdder();
        final LongAdder latencySumMs = new LongAdder();
    }

    private static final class UpstreamBucket {
        final LongAdder requests = new LongAdder();
        final LongAdder errors = new LongAdder();
        final LongAdder rateLimited = new LongAdder();
        final LongAdder timeouts = new LongAdder();
    }
}
