package com.tool.invocation.api;

import com.tool.invocation.cache.CaffeineDedupCache;
import com.tool.invocation.cache.DedupCache;
import com.tool.invocation.cache.Fingerprints;
import com.tool.invocation.cache.NoOpDedupCache;
import com.tool.invocation.diagnostics.ArgumentPreview;
import com.tool.invocation.diagnostics.DiagnosticRecord;
import com.tool.invocation.diagnostics.DiagnosticsStore;
import com.tool.invocation.error.Classification;
import com.tool.invocation.error.ErrorClassifier;
import com.tool.invocation.error.RemediationAdvisor;
import com.tool.invocation.error.ToolErrorPayload;
import com.tool.invocation.error.ToolInvocationException;
import com.tool.invocation.error.ToolTimeoutException;
import com.tool.invocation.error.ToolValidationException;
import com.tool.invocation.gate.WriteGate;
import com.tool.invocation.gate.WriteGateState;
import com.tool.invocation.health.CredentialHealthCheck;
import com.tool.invocation.health.DiagnosticsHealthCheck;
import com.tool.invocation.health.HealthCheckRegistry;
import com.tool.invocation.logging.LogContext;
import com.tool.invocation.metrics.InMemoryMetricsService;
import com.tool.invocation.metrics.MetricsService;
import com.tool.invocation.schema.ArgumentNormalizer;
import com.tool.invocation.schema.SchemaValidator;
import com.tool.invocation.schema.ValidationResult;
import com.tool.invocation.tool.ToolArguments;
import com.tool.invocation.tool.ToolDescriptor;
import com.tool.invocation.tool.ToolRegistry;
import com.tool.invocation.tracing.CallSpan;
import com.tool.invocation.tracing.NoOpTracingService;
import com.tool.invocation.tracing.TracingService;
import com.tool.invocation.upstream.CredentialProbe;
import com.tool.invocation.upstream.OutboundLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs every tool call through one lifecycle:
 * normalize arguments, validate them, check the write gate (mutating tools only), look up the
 * dedup cache, execute, then record diagnostics, metrics and the trace span exactly once.
 *
 * <p>{@link #dispatch(String, Map)} never blocks the caller. Business failures, including
 * validation and authorization failures, complete the returned future with a {@link ToolResult}
 * carrying a {@link ToolErrorPayload}. Cancellation is not a failure: cancelling the returned
 * future cancels the execution and leaves the future cancelled, and an execution cancelled
 * elsewhere completes it with a {@link CancellationException}.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (ToolDispatcher dispatcher = ToolDispatcher.builder()
 *         .registry(registry)
 *         .options(DispatcherOptions.defaults())
 *         .build()) {
 *     ToolResult result = dispatcher.dispatch("echo", Map.of("value", 1)).join();
 * }
 * </pre>
 */
public class ToolDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    static final String STATUS_OK = "ok";
    static final String STATUS_ERROR = "error";
    static final String STATUS_CANCELLED = "cancelled";

    private final ToolRegistry registry;
    private final DispatcherOptions options;
    private final ArgumentNormalizer normalizer;
    private final SchemaValidator validator;
    private final WriteGate writeGate;
    private final DedupCache dedupCache;
    private final ErrorClassifier classifier;
    private final RemediationAdvisor advisor;
    private final DiagnosticsStore diagnostics;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final OutboundLimiter outboundLimiter;
    private final CredentialProbe credentialProbe;
    private final HealthCheckRegistry healthChecks;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final ScheduledExecutorService timer;
    private final ToolIntrospection introspection;

    private ToolDispatcher(Builder builder) {
        this.registry = builder.registry;
        this.options = builder.options;
        this.normalizer = new ArgumentNormalizer();
        this.validator = new SchemaValidator();
        this.clock = builder.clock;
        this.idGenerator = builder.idGenerator;
        this.classifier = new ErrorClassifier();
        this.advisor = new RemediationAdvisor(options.getLocalFallbacks());

        WriteGateState gateState = builder.writeGateState != null
                ? builder.writeGateState
                : new WriteGateState(options.isWriteAllowed(), options.getProtectedRef());
        this.writeGate = new WriteGate(gateState, options.getWriteGatePolicy());

        if (builder.dedupCache != null) {
            this.dedupCache = builder.dedupCache;
        } else if (options.isDedupEnabled()) {
            this.dedupCache = new CaffeineDedupCache(options.dedupConfig());
        } else {
            this.dedupCache = new NoOpDedupCache();
        }

        this.diagnostics = builder.diagnostics != null
                ? builder.diagnostics : new DiagnosticsStore(options.diagnosticsConfig());
        this.metrics = builder.metricsService != null
                ? builder.metricsService : new InMemoryMetricsService();
        this.tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.outboundLimiter = new OutboundLimiter(options.getOutboundConcurrency(), metrics);
        this.credentialProbe = builder.credentialProbe != null
                ? builder.credentialProbe : CredentialProbe.constant(false);

        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newFixedThreadPool(options.getWorkerThreads(), threadFactory("tool-worker"));
            this.ownsExecutor = true;
        }
        this.timer = Executors.newSingleThreadScheduledExecutor(threadFactory("tool-deadline"));

        this.healthChecks = new HealthCheckRegistry();
        healthChecks.register(new CredentialHealthCheck(credentialProbe));
        healthChecks.register(new DiagnosticsHealthCheck(diagnostics));

        this.introspection = new ToolIntrospection(this);
        if (builder.introspectionTools) {
            IntrospectionTools.registerAll(registry, introspection);
        }

        log.info("ToolDispatcher initialized: tools={}, workers={}, dedup={}, validation={}, writeGate={}/{}",
                registry.size(), options.getWorkerThreads(), options.isDedupEnabled(),
                options.isSchemaValidationEnabled(), options.getWriteGatePolicy(), gateState.getProtectedRef());
    }

    // ========== Dispatch ==========

    /**
     * Dispatches one call.
     *
     * @param requestedName tool name as sent by the client; common variants are resolved by the registry
     * @param args          raw call arguments, may be null
     * @return a future completing with the call's result, or cancelled when the call was cancelled
     */
    public CompletableFuture<ToolResult> dispatch(String requestedName, Map<String, Object> args) {
        String callId = idGenerator.get();
        Instant start = clock.instant();
        Map<String, Object> rawArgs = args != null ? args : Map.of();

        Optional<ToolDescriptor> found = registry.find(requestedName);
        if (found.isEmpty()) {
            String name = requestedName != null ? requestedName : "";
            CallContext ctx = new CallContext(callId, name, name, false, rawArgs, start);
            CompletableFuture<ToolResult> result = new CompletableFuture<>();
            CallSpan span = startSpan(ctx);
            complete(result, ctx, null, span, new CallOutcome.BusinessError(unknownTool(name)));
            return result;
        }

        ToolDescriptor tool = found.get();
        Map<String, Object> schema = tool.schema();
        Map<String, Object> normalized = normalizer.normalize(schema, rawArgs);
        CallContext ctx = new CallContext(callId, requestedName, tool.name(), tool.mutating(), normalized, start);
        CallSpan span = startSpan(ctx);
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        logLine(ctx, Level.DEBUG, "tool.call.start requested={} targetRef={}", requestedName, ctx.targetRef());

        try {
            if (options.isSchemaValidationEnabled()) {
                ValidationResult validation = validator.validate(schema, normalized);
                if (!validation.valid()) {
                    throw new ToolValidationException(
                            "Invalid arguments for '" + tool.name() + "': " + String.join("; ", validation.errors()),
                            validation.errors(), validation.guidance());
                }
            }
            if (tool.mutating()) {
                writeGate.checkAll(tool.name(), ctx.targetRefs());
            }
        } catch (ToolInvocationException | IllegalArgumentException e) {
            complete(result, ctx, tool, span, new CallOutcome.BusinessError(e));
            return result;
        }

        CompletableFuture<Object> execution = startExecution(tool, ctx);
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> deadline = scheduleDeadline(execution, timedOut);

        execution.whenComplete((value, error) -> {
            if (deadline != null) {
                deadline.cancel(false);
            }
            complete(result, ctx, tool, span, toOutcome(tool, value, error, timedOut.get()));
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                execution.cancel(true);
            }
        });
        return result;
    }

    /**
     * Blocking convenience for callers that are not themselves asynchronous.
     *
     * @throws CancellationException if the call was cancelled
     */
    public ToolResult call(String requestedName, Map<String, Object> args) {
        return dispatch(requestedName, args).join();
    }

    private CompletableFuture<Object> startExecution(ToolDescriptor tool, CallContext ctx) {
        try {
            if (!tool.deduplicated()) {
                return execute(tool, ctx);
            }
            String fingerprint = Fingerprints.of(tool.name(), ctx.arguments());
            return dedupCache.runDeduped(executor, fingerprint, () -> execute(tool, ctx), options.getDedupTtl());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Object> execute(ToolDescriptor tool, CallContext ctx) {
        ToolArguments arguments = new ToolArguments(ctx.callId(), tool.name(), ctx.arguments());
        if (tool.isAsync()) {
            return executeAsync(tool, ctx, arguments);
        }

        CompletableFuture<Object> execution = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                if (execution.isDone()) {
                    return;
                }
                try (LogContext lc = LogContext.forToolCall(ctx.callId(), tool.name(), tool.mutating())) {
                    execution.complete(tool.handler().handle(arguments));
                } catch (Throwable t) {
                    execution.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            execution.completeExceptionally(new IllegalStateException("Dispatcher is shut down", e));
            return execution;
        }
        execution.whenComplete((value, error) -> {
            if (execution.isCancelled()) {
                task.cancel(true);
            }
        });
        return execution;
    }

    private CompletableFuture<Object> executeAsync(ToolDescriptor tool, CallContext ctx, ToolArguments arguments) {
        CompletableFuture<Object> execution = new CompletableFuture<>();
        CompletionStage<?> stage;
        try (LogContext lc = LogContext.forToolCall(ctx.callId(), tool.name(), tool.mutating())) {
            stage = tool.asyncHandler().handle(arguments);
        } catch (RuntimeException e) {
            execution.completeExceptionally(e);
            return execution;
        }
        if (stage == null) {
            execution.completeExceptionally(new IllegalStateException(
                    "Tool '" + tool.name() + "' returned no completion stage"));
            return execution;
        }
        stage.whenComplete((value, error) -> {
            if (error == null) {
                execution.complete(value);
            } else {
                execution.completeExceptionally(ErrorClassifier.unwrap(error));
            }
        });
        execution.whenComplete((value, error) -> {
            if (execution.isCancelled() && stage instanceof Future<?> future) {
                future.cancel(true);
            }
        });
        return execution;
    }

    private ScheduledFuture<?> scheduleDeadline(CompletableFuture<Object> execution, AtomicBoolean timedOut) {
        Duration timeout = options.getCallTimeout();
        if (timeout.isZero() || execution.isDone()) {
            return null;
        }
        return timer.schedule(() -> {
            if (!execution.isDone()) {
                timedOut.set(true);
                execution.cancel(true);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CallOutcome toOutcome(ToolDescriptor tool, Object value, Throwable error, boolean timedOut) {
        if (error == null) {
            return new CallOutcome.Success(value);
        }
        Throwable cause = ErrorClassifier.unwrap(error);
        if (cause instanceof CancellationException cancellation) {
            if (timedOut) {
                return new CallOutcome.BusinessError(new ToolTimeoutException(tool.name(), options.getCallTimeout()));
            }
            return new CallOutcome.Cancelled(cancellation);
        }
        return new CallOutcome.BusinessError(cause);
    }

    // ========== Recording ==========

    private void complete(CompletableFuture<ToolResult> result, CallContext ctx, ToolDescriptor tool,
                          CallSpan span, CallOutcome outcome) {
        if (!ctx.markRecorded()) {
            return;
        }
        long durationMs = Math.max(0, clock.millis() - ctx.startTime().toEpochMilli());
        try {
            if (outcome instanceof CallOutcome.Success success) {
                recordSuccess(ctx, tool, span, durationMs);
                result.complete(ToolResult.success(ctx.callId(), ctx.toolName(), success.value(), durationMs));
            } else if (outcome instanceof CallOutcome.Cancelled cancelled) {
                recordCancelled(ctx, tool, span, durationMs);
                result.completeExceptionally(cancelled.cause());
            } else if (outcome instanceof CallOutcome.BusinessError failure) {
                ToolErrorPayload payload = recordFailure(ctx, tool, span, durationMs, failure.error());
                result.complete(ToolResult.failure(ctx.callId(), ctx.toolName(), payload, durationMs));
            }
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of call {}", ctx.callId(), e);
            result.completeExceptionally(e);
        } finally {
            span.close();
        }
    }

    private void recordSuccess(CallContext ctx, ToolDescriptor tool, CallSpan span, long durationMs) {
        diagnostics.append(event(ctx, STATUS_OK, "Call succeeded", durationMs).build());
        logLine(ctx, Level.DEBUG, "tool.call.ok durationMs={}", durationMs);
        metrics.recordToolCall(ctx.toolName(), ctx.mutating(), durationMs, false);
        span.setAttribute("duration_ms", durationMs);
        span.setStatus(CallSpan.SpanStatus.OK);
        if (tool != null && tool.mutating()) {
            dedupCache.invalidateAll(executor);
        }
    }

    private void recordCancelled(CallContext ctx, ToolDescriptor tool, CallSpan span, long durationMs) {
        diagnostics.append(event(ctx, STATUS_CANCELLED, "Call cancelled by caller", durationMs).build());
        logLine(ctx, Level.INFO, "tool.call.cancelled durationMs={}", durationMs);
        if (tool != null) {
            metrics.recordToolCall(ctx.toolName(), ctx.mutating(), durationMs, false);
        }
        span.addEvent(STATUS_CANCELLED);
    }

    private ToolErrorPayload recordFailure(CallContext ctx, ToolDescriptor tool, CallSpan span,
                                           long durationMs, Throwable error) {
        Classification classification = classifier.classify(error);
        Map<String, Object> details = new LinkedHashMap<>();
        if (error instanceof ToolInvocationException tie) {
            details.putAll(tie.getDetails());
        }
        if (error instanceof ToolValidationException tve && !tve.getErrors().isEmpty()) {
            details.put("errors", tve.getErrors());
        }
        ToolErrorPayload payload = new ToolErrorPayload(
                classification.category(),
                classification.origin(),
                classification.message(),
                ctx.toolName(),
                ctx.callId(),
                classification.retryable(),
                advisor.advise(classification.category(), classification.origin(), ctx.toolName()),
                details);

        diagnostics.append(event(ctx, STATUS_ERROR, classification.message(), durationMs)
                .category(classification.category())
                .origin(classification.origin())
                .build());
        diagnostics.append(DiagnosticRecord.builder(DiagnosticRecord.Kind.ERROR)
                .callId(ctx.callId())
                .toolName(ctx.toolName())
                .timestamp(clock.instant())
                .status(STATUS_ERROR)
                .message(classification.message())
                .category(classification.category())
                .origin(classification.origin())
                .detail("exception", error.getClass().getName())
                .detail("retryable", classification.retryable())
                .detail("duration_ms", durationMs)
                .details(details)
                .details(ArgumentPreview.details(ctx.arguments()))
                .build());
        logLine(ctx, Level.WARN, "tool.call.error category={} origin={} durationMs={} message={}",
                classification.category().wireName(), classification.origin().wireName(), durationMs,
                classification.message());
        if (tool != null) {
            metrics.recordToolCall(ctx.toolName(), ctx.mutating(), durationMs, true);
        }
        span.setAttribute("error.category", classification.category().wireName());
        span.recordException(error);
        span.setStatus(CallSpan.SpanStatus.ERROR);
        return payload;
    }

    private DiagnosticRecord.Builder event(CallContext ctx, String status, String message, long durationMs) {
        return DiagnosticRecord.builder(DiagnosticRecord.Kind.EVENT)
                .callId(ctx.callId())
                .toolName(ctx.toolName())
                .timestamp(clock.instant())
                .status(status)
                .message(message)
                .detail("mutating", ctx.mutating())
                .detail("duration_ms", durationMs)
                .detail("target_ref", ctx.targetRef())
                .detail("target_path", ctx.targetPath())
                .details(ArgumentPreview.details(ctx.arguments()));
    }

    /**
     * Logs through SLF4J and mirrors the line into the diagnostics log buffer.
     */
    private void logLine(CallContext ctx, Level level, String format, Object... args) {
        try (LogContext lc = LogContext.forToolCall(ctx.callId(), ctx.toolName(), ctx.mutating())) {
            log.atLevel(level).log(format, args);
        }
        diagnostics.append(DiagnosticRecord.builder(DiagnosticRecord.Kind.LOG)
                .callId(ctx.callId())
                .toolName(ctx.toolName())
                .timestamp(clock.instant())
                .status(level.name().toLowerCase(Locale.ROOT))
                .message(MessageFormatter.arrayFormat(format, args).getMessage())
                .build());
    }

    private CallSpan startSpan(CallContext ctx) {
        return tracing.startSpan(TracingService.TOOL_CALL_SPAN, Map.of(
                "tool", ctx.toolName(),
                "call_id", ctx.callId(),
                "mutating", Boolean.toString(ctx.mutating())));
    }

    ToolValidationException unknownTool(String requestedName) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested_tool", requestedName);
        registry.suggest(requestedName).ifPresent(s -> details.put("suggested_tool", s));
        details.put("available_tools", registry.size());
        String hint = details.containsKey("suggested_tool")
                ? " Did you mean '" + details.get("suggested_tool") + "'?"
                : " Use list_tools to see available tools.";
        return new ToolValidationException("Unknown tool '" + requestedName + "'." + hint,
                List.of("unknown tool: " + requestedName), details);
    }

    // ========== Accessors ==========

    public ToolRegistry getRegistry() {
        return registry;
    }

    public DispatcherOptions getOptions() {
        return options;
    }

    public WriteGate getWriteGate() {
        return writeGate;
    }

    public DedupCache getDedupCache() {
        return dedupCache;
    }

    public DiagnosticsStore getDiagnostics() {
        return diagnostics;
    }

    public MetricsService getMetricsService() {
        return metrics;
    }

    public OutboundLimiter getOutboundLimiter() {
        return outboundLimiter;
    }

    public CredentialProbe getCredentialProbe() {
        return credentialProbe;
    }

    public HealthCheckRegistry getHealthChecks() {
        return healthChecks;
    }

    public ToolIntrospection introspection() {
        return introspection;
    }

    SchemaValidator validator() {
        return validator;
    }

    ArgumentNormalizer normalizer() {
        return normalizer;
    }

    Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        timer.shutdownNow();
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("ToolDispatcher closed");
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ToolRegistry registry;
        private DispatcherOptions options = DispatcherOptions.defaults();
        private WriteGateState writeGateState;
        private DedupCache dedupCache;
        private DiagnosticsStore diagnostics;
        private MetricsService metricsService;
        private TracingService tracingService;
        private CredentialProbe credentialProbe;
        private ExecutorService executor;
        private Clock clock = Clock.systemUTC();
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();
        private boolean introspectionTools = true;

        public Builder registry(ToolRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder options(DispatcherOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Shares one write-gate state between dispatchers; by default each dispatcher creates its own from the options.
         */
        public Builder writeGateState(WriteGateState writeGateState) {
            this.writeGateState = writeGateState;
            return this;
        }

        public Builder dedupCache(DedupCache dedupCache) {
            this.dedupCache = dedupCache;
            return this;
        }

        public Builder diagnostics(DiagnosticsStore diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder credentialProbe(CredentialProbe credentialProbe) {
            this.credentialProbe = credentialProbe;
            return this;
        }

        /**
         * Worker pool for synchronous tools; it is also the scheduler that scopes dedup entries.
         * A caller-supplied executor is not shut down by {@link ToolDispatcher#close()}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        /**
         * Whether to register list_tools, describe_tool and the other introspection tools. Default true.
         */
        public Builder introspectionTools(boolean introspectionTools) {
            this.introspectionTools = introspectionTools;
            return this;
        }

        public ToolDispatcher build() {
            if (registry == null) {
                throw new IllegalStateException("ToolRegistry is required");
            }
            if (options == null) {
                throw new IllegalStateException("DispatcherOptions is required");
            }
            if (clock == null || idGenerator == null) {
                throw new IllegalStateException("clock and idGenerator are required");
            }
            return new ToolDispatcher(this);
        }
    }
}
