package com.tool.invocation.cdi;

import com.tool.invocation.api.DispatcherOptions;
import com.tool.invocation.api.ToolDispatcher;
import com.tool.invocation.gate.WriteGatePolicy;
import com.tool.invocation.metrics.InMemoryMetricsService;
import com.tool.invocation.metrics.MetricsService;
import com.tool.invocation.metrics.MicrometerMetricsService;
import com.tool.invocation.tool.ToolRegistry;
import com.tool.invocation.tracing.NoOpTracingService;
import com.tool.invocation.tracing.OpenTelemetryTracingService;
import com.tool.invocation.tracing.TracingService;
import com.tool.invocation.upstream.CredentialProbe;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the tool invocation core from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus), it produces a
 * {@link ToolRegistry} and a {@link ToolDispatcher} built on it. Tool modules inject the registry
 * and register their descriptors at startup; the transport adapter injects the dispatcher.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * tool-server:
 *   dedup:
 *     enabled: true
 *     ttl-millis: 5000
 *   diagnostics:
 *     events-capacity: 2000
 *   write-gate:
 *     allowed: false
 *     protected-ref: main
 *     policy: protected_ref
 *   credential:
 *     env-vars: GITHUB_TOKEN,GH_TOKEN
 * </pre>
 *
 * <p>A {@link MeterRegistry} or OpenTelemetry {@link Tracer} bean, when the container provides
 * one, is picked up for metrics and tracing.</p>
 */
@ApplicationScoped
public class ToolDispatcherProducer {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcherProducer.class);

    // ── Dedup ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-server.dedup.enabled", defaultValue = "true")
    boolean dedupEnabled;

    @Inject
    @ConfigProperty(name = "tool-server.dedup.ttl-millis", defaultValue = "5000")
    long dedupTtlMillis;

    @Inject
    @ConfigProperty(name = "tool-server.dedup.max-entries", defaultValue = "10000")
    int dedupMaxEntries;

    // ── Diagnostics ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-server.diagnostics.events-capacity", defaultValue = "2000")
    int eventsCapacity;

    @Inject
    @ConfigProperty(name = "tool-server.diagnostics.logs-capacity", defaultValue = "2000")
    int logsCapacity;

    @Inject
    @ConfigProperty(name = "tool-server.diagnostics.errors-capacity", defaultValue = "500")
    int errorsCapacity;

    // ── Execution ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-server.outbound.concurrency", defaultValue = "8")
    int outboundConcurrency;

    @Inject
    @ConfigProperty(name = "tool-server.worker-threads", defaultValue = "4")
    int workerThreads;

    @Inject
    @ConfigProperty(name = "tool-server.call.timeout-millis", defaultValue = "0")
    long callTimeoutMillis;

    @Inject
    @ConfigProperty(name = "tool-server.schema.validation-enabled", defaultValue = "true")
    boolean schemaValidationEnabled;

    // ── Write gate ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-server.write-gate.allowed", defaultValue = "false")
    boolean writeAllowed;

    @Inject
    @ConfigProperty(name = "tool-server.write-gate.protected-ref", defaultValue = "main")
    String protectedRef;

    @Inject
    @ConfigProperty(name = "tool-server.write-gate.policy", defaultValue = "protected_ref")
    String writeGatePolicy;

    // ── Remediation / credentials ─────────────────────────────

    /** Entries of the form {@code remote_tool=local_tool}. */
    @Inject
    @ConfigProperty(name = "tool-server.remediation.local-fallbacks")
    Optional<List<String>> localFallbacks;

    @Inject
    @ConfigProperty(name = "tool-server.credential.env-vars", defaultValue = "GITHUB_TOKEN,GH_TOKEN")
    List<String> credentialEnvVars;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ToolRegistry toolRegistry() {
        return new ToolRegistry();
    }

    @Produces
    @ApplicationScoped
    public ToolDispatcher toolDispatcher(ToolRegistry registry) {
        DispatcherOptions options = options();
        log.info("Producing ToolDispatcher: dedup={} ttl={}ms validation={} writeGate={}/{} timeout={}ms",
                options.isDedupEnabled(), dedupTtlMillis, options.isSchemaValidationEnabled(),
                options.getWriteGatePolicy(), options.getProtectedRef(), callTimeoutMillis);

        return ToolDispatcher.builder()
                .registry(registry)
                .options(options)
                .metricsService(metricsService())
                .tracingService(tracingService())
                .credentialProbe(CredentialProbe.fromEnvironment(credentialEnvVars.toArray(new String[0])))
                .build();
    }

    public void closeDispatcher(@Disposes ToolDispatcher dispatcher) {
        log.info("Closing ToolDispatcher");
        dispatcher.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    DispatcherOptions options() {
        DispatcherOptions.Builder builder = DispatcherOptions.builder()
                .dedupEnabled(dedupEnabled)
                .dedupTtl(Duration.ofMillis(dedupTtlMillis))
                .dedupMaxEntries(dedupMaxEntries)
                .eventsCapacity(eventsCapacity)
                .logsCapacity(logsCapacity)
                .errorsCapacity(errorsCapacity)
                .outboundConcurrency(outboundConcurrency)
                .workerThreads(workerThreads)
                .callTimeout(Duration.ofMillis(callTimeoutMillis))
                .schemaValidationEnabled(schemaValidationEnabled)
                .writeAllowed(writeAllowed)
                .protectedRef(protectedRef)
                .writeGatePolicy(parsePolicy(writeGatePolicy));

        localFallbacks.ifPresent(entries -> entries.forEach(entry -> {
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                log.warn("Ignoring malformed local fallback '{}', expected remote_tool=local_tool", entry);
                return;
            }
            builder.localFallback(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
        }));
        return builder.build();
    }

    static WriteGatePolicy parsePolicy(String value) {
        try {
            return WriteGatePolicy.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown write-gate policy '" + value
                    + "', expected protected_ref or allow_all", e);
        }
    }

    private MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Recording tool metrics to Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new InMemoryMetricsService();
    }

    private TracingService tracingService() {
        if (tracer != null && tracer.isResolvable()) {
            log.info("Tracing tool calls with OpenTelemetry");
            return new OpenTelemetryTracingService(tracer.get());
        }
        return new NoOpTracingService();
    }
}
