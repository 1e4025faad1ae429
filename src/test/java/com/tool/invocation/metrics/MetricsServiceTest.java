package com.tool.invocation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("InMemoryMetricsService")
    class InMemoryTests {

        private final InMemoryMetricsService metrics = new InMemoryMetricsService();

        @Test
        @DisplayName("Should count calls, errors, mutating calls and latency per tool")
        void toolCounters() {
            metrics.recordToolCall("create_file", true, 120, false);
            metrics.recordToolCall("create_file", true, 30, true);
            metrics.recordToolCall("get_issue", false, 5, false);

            MetricsSnapshot snapshot = metrics.snapshot();

            assertEquals(new MetricsSnapshot.ToolCounters(2, 1, 2, 150), snapshot.tool("create_file"));
            assertEquals(new MetricsSnapshot.ToolCounters(1, 0, 0, 5), snapshot.tool("get_issue"));
            assertEquals(List.of("create_file", "get_issue"), List.copyOf(snapshot.tools().keySet()));
        }

        @Test
        @DisplayName("Negative durations are clamped to zero")
        void negativeDuration() {
            metrics.recordToolCall("t", false, -10, false);

            assertEquals(0, metrics.snapshot().tool("t").latencySumMs());
        }

        @Test
        @DisplayName("Should count upstream requests by outcome")
        void upstreamCounters() {
            metrics.recordUpstreamRequest("github", false, false, false);
            metrics.recordUpstreamRequest("github", true, true, false);
            metrics.recordUpstreamRequest("github", true, false, true);

            assertEquals(new MetricsSnapshot.UpstreamCounters(3, 2, 1, 1), metrics.snapshot().dependency("github"));
        }

        @Test
        @DisplayName("Unknown names read as zero and the snapshot is detached")
        void zeroAndDetached() {
            MetricsSnapshot before = metrics.snapshot();
            metrics.recordToolCall("t", false, 1, false);

            assertEquals(0, before.tool("t").callsTotal());
            assertEquals(0, metrics.snapshot().dependency("none").requestsTotal());
        }

        @Test
        @DisplayName("toMap uses snake_case counter names")
        void toMap() {
            metrics.recordToolCall("t", false, 7, true);

            @SuppressWarnings("unchecked")
            Map<String, Object> tools = (Map<String, Object>) metrics.snapshot().toMap().get("tools");

            assertEquals(Map.of("calls_total", 1L, "errors_total", 1L, "mutating_calls_total", 0L,
                    "latency_sum_ms", 7L), tools.get("t"));
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record tool calls as tagged timers")
        void toolTimer() {
            metrics.recordToolCall("create_file", true, 150, false);
            metrics.recordToolCall("create_file", true, 250, false);

            Timer timer = registry.find("tool.calls")
                    .tag("tool", "create_file")
                    .tag("mutating", "true")
                    .tag("outcome", "ok")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
        }

        @Test
        @DisplayName("Should count failed tool calls")
        void toolErrors() {
            metrics.recordToolCall("get_issue", false, 10, true);

            Counter counter = registry.find("tool.errors").tag("tool", "get_issue").counter();

            assertNotNull(counter);
            assertEquals(1.0, counter.count());
            assertNotNull(registry.find("tool.calls").tag("outcome", "error").timer());
        }

        @Test
        @DisplayName("Should count upstream requests, rate limits and timeouts")
        void upstream() {
            metrics.recordUpstreamRequest("github", false, false, false);
            metrics.recordUpstreamRequest("github", true, true, false);
            metrics.recordUpstreamRequest("github", true, false, true);

            assertEquals(1.0, registry.find("upstream.requests").tag("outcome", "ok").counter().count());
            assertEquals(2.0, registry.find("upstream.requests").tag("outcome", "error").counter().count());
            assertEquals(1.0, registry.find("upstream.rate_limited").tag("dependency", "github").counter().count());
            assertEquals(1.0, registry.find("upstream.timeouts").tag("dependency", "github").counter().count());
        }

        @Test
        @DisplayName("The snapshot mirrors what was published")
        void snapshot() {
            metrics.recordToolCall("t", false, 3, false);

            assertEquals(1, metrics.snapshot().tool("t").callsTotal());
        }
    }
}
