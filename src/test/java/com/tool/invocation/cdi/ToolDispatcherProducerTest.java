package com.tool.invocation.cdi;

import com.tool.invocation.api.DispatcherOptions;
import com.tool.invocation.api.ToolDispatcher;
import com.tool.invocation.gate.WriteGatePolicy;
import com.tool.invocation.metrics.InMemoryMetricsService;
import com.tool.invocation.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ToolDispatcherProducer Tests")
class ToolDispatcherProducerTest {

    private ToolDispatcherProducer producer;

    @BeforeEach
    void setUp() {
        producer = new ToolDispatcherProducer();
        producer.dedupEnabled = true;
        producer.dedupTtlMillis = 1_500;
        producer.dedupMaxEntries = 100;
        producer.eventsCapacity = 10;
        producer.logsCapacity = 20;
        producer.errorsCapacity = 5;
        producer.outboundConcurrency = 2;
        producer.workerThreads = 1;
        producer.callTimeoutMillis = 0;
        producer.schemaValidationEnabled = true;
        producer.writeAllowed = false;
        producer.protectedRef = "release";
        producer.writeGatePolicy = "protected_ref";
        producer.localFallbacks = Optional.empty();
        producer.credentialEnvVars = List.of("TOOL_TEST_TOKEN_THAT_IS_NOT_SET");
    }

    @Nested
    @DisplayName("Options")
    class OptionsTests {

        @Test
        @DisplayName("Config properties map onto dispatcher options")
        void mapsProperties() {
            DispatcherOptions options = producer.options();

            assertEquals(Duration.ofMillis(1_500), options.getDedupTtl());
            assertEquals(100, options.getDedupMaxEntries());
            assertEquals(10, options.getEventsCapacity());
            assertEquals(20, options.getLogsCapacity());
            assertEquals(5, options.getErrorsCapacity());
            assertEquals(2, options.getOutboundConcurrency());
            assertEquals(1, options.getWorkerThreads());
            assertEquals("release", options.getProtectedRef());
            assertEquals(WriteGatePolicy.PROTECTED_REF, options.getWriteGatePolicy());
            assertFalse(options.isWriteAllowed());
        }

        @Test
        @DisplayName("Local fallbacks are parsed and malformed entries skipped")
        void localFallbacks() {
            producer.localFallbacks = Optional.of(List.of(
                    "create_pull_request = local_git_push", "broken", "=x", "y="));

            assertEquals(Map.of("create_pull_request", "local_git_push"), producer.options().getLocalFallbacks());
        }
    }

    @Nested
    @DisplayName("Policy parsing")
    class PolicyTests {

        @Test
        @DisplayName("Accepts snake, kebab and upper case spellings")
        void spellings() {
            assertEquals(WriteGatePolicy.PROTECTED_REF, ToolDispatcherProducer.parsePolicy("protected_ref"));
            assertEquals(WriteGatePolicy.ALLOW_ALL, ToolDispatcherProducer.parsePolicy(" allow-all "));
            assertEquals(WriteGatePolicy.ALLOW_ALL, ToolDispatcherProducer.parsePolicy("ALLOW_ALL"));
        }

        @Test
        @DisplayName("Rejects unknown policies")
        void unknown() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> ToolDispatcherProducer.parsePolicy("sometimes"));

            assertTrue(e.getMessage().contains("sometimes"));
        }
    }

    @Test
    @DisplayName("Produces a dispatcher with in-memory metrics when no meter registry is available")
    void producesDispatcher() {
        ToolRegistry registry = producer.toolRegistry();

        try (ToolDispatcher dispatcher = producer.toolDispatcher(registry)) {
            assertSame(registry, dispatcher.getRegistry());
            assertInstanceOf(InMemoryMetricsService.class, dispatcher.getMetricsService());
            assertFalse(dispatcher.getCredentialProbe().hasCredential());
            assertEquals("release", dispatcher.getWriteGate().state().getProtectedRef());
        }
    }
}
