package com.tool.invocation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Counts are kept in an {@link InMemoryMetricsService} for {@link #snapshot()} and mirrored to:</p>
 * <ul>
 *   <li>{@code tool.calls}: Timer (tags: tool, mutating, outcome)</li>
 *   <li>{@code tool.errors}: Counter (tag: tool)</li>
 *   <li>{@code upstream.requests}: Counter (tags: dependency, outcome)</li>
 *   <li>{@code upstream.rate_limited}: Counter (tag: dependency)</li>
 *   <li>{@code upstream.timeouts}: Counter (tag: dependency)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final InMemoryMetricsService counters = new InMemoryMetricsService();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordToolCall(String toolName, boolean mutating, long durationMs, boolean errored) {
        counters.recordToolCall(toolName, mutating, durationMs, errored);
        String outcome = errored ? "error" : "ok";
        String key = toolName + ":" + mutating + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("tool.calls")
                        .description("Duration of tool calls")
                        .tag("tool", toolName)
                        .tag("mutating", Boolean.toString(mutating))
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(Duration.ofMillis(Math.max(0, durationMs)));
        if (errored) {
            counter("tool.errors", "tool", toolName, "Number of failed tool calls").increment();
        }
    }

    @Override
    public void recordUpstreamRequest(String dependency, boolean errored, boolean rateLimited, boolean timedOut) {
        counters.recordUpstreamRequest(dependency, errored, rateLimited, timedOut);
        String outcome = errored ? "error" : "ok";
        String key = "upstream.requests:" + dependency + ":" + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("upstream.requests")
                        .description("Requests to external collaborators")
                        .tag("dependency", dependency)
                        .tag("outcome", outcome)
                        .register(registry)).increment();
        if (rateLimited) {
            counter("upstream.rate_limited", "dependency", dependency, "Rate-limited upstream requests").increment();
        }
        if (timedOut) {
            counter("upstream.timeouts", "dependency", dependency, "Timed-out upstream requests").increment();
        }
    }

    @Override
    public MetricsSnapshot snapshot() {
        return counters.snapshot();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
