package com.tool.invocation.metrics;

/**
 * Records per-tool and per-upstream-dependency counters.
 * All counters are monotonic.
 *
 * <p>The default {@link InMemoryMetricsService} needs no dependencies; {@link MicrometerMetricsService}
 * additionally publishes to a Micrometer registry when {@code micrometer-core} is on the classpath.</p>
 */
public interface MetricsService {

    /**
     * Records one completed tool call.
     *
     * @param toolName   registered tool name
     * @param mutating   whether the tool is mutating
     * @param durationMs wall-clock duration of the call
     * @param errored    whether the call ended in a classified failure
     */
    void recordToolCall(String toolName, boolean mutating, long durationMs, boolean errored);

    /**
     * Records one request to an external collaborator.
     */
    void recordUpstreamRequest(String dependency, boolean errored, boolean rateLimited, boolean timedOut);

    /**
     * Immutable view of all counters.
     */
    MetricsSnapshot snapshot();
}
