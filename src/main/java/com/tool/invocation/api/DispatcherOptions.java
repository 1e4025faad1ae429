package com.tool.invocation.api;

import com.tool.invocation.cache.DedupConfig;
import com.tool.invocation.diagnostics.DiagnosticsConfig;
import com.tool.invocation.gate.WriteGatePolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a {@link ToolDispatcher}.
 * Configures dedup, diagnostics capacities, outbound concurrency, the write gate and validation.
 */
public class DispatcherOptions {

    private static final Duration DEFAULT_DEDUP_TTL = Duration.ofSeconds(5);
    private static final int DEFAULT_DEDUP_MAX_ENTRIES = 10_000;
    private static final int DEFAULT_EVENTS_CAPACITY = 2_000;
    private static final int DEFAULT_LOGS_CAPACITY = 2_000;
    private static final int DEFAULT_ERRORS_CAPACITY = 500;
    private static final int DEFAULT_OUTBOUND_CONCURRENCY = 8;
    private static final int DEFAULT_WORKER_THREADS = 4;

    private final Duration dedupTtl;
    private final boolean dedupEnabled;
    private final int dedupMaxEntries;
    private final int eventsCapacity;
    private final int logsCapacity;
    private final int errorsCapacity;
    private final int outboundConcurrency;
    private final boolean writeAllowed;
    private final String protectedRef;
    private final WriteGatePolicy writeGatePolicy;
    private final boolean schemaValidationEnabled;
    private final Duration callTimeout;
    private final int workerThreads;
    private final Map<String, String> localFallbacks;

    private DispatcherOptions(Builder builder) {
        this.dedupTtl = builder.dedupTtl;
        this.dedupEnabled = builder.dedupEnabled;
        this.dedupMaxEntries = builder.dedupMaxEntries;
        this.eventsCapacity = builder.eventsCapacity;
        this.logsCapacity = builder.logsCapacity;
        this.errorsCapacity = builder.errorsCapacity;
        this.outboundConcurrency = builder.outboundConcurrency;
        this.writeAllowed = builder.writeAllowed;
        this.protectedRef = builder.protectedRef;
        this.writeGatePolicy = builder.writeGatePolicy;
        this.schemaValidationEnabled = builder.schemaValidationEnabled;
        this.callTimeout = builder.callTimeout;
        this.workerThreads = builder.workerThreads;
        this.localFallbacks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.localFallbacks));
    }

    public Duration getDedupTtl() {
        return dedupTtl;
    }

    public boolean isDedupEnabled() {
        return dedupEnabled;
    }

    public int getDedupMaxEntries() {
        return dedupMaxEntries;
    }

    public int getEventsCapacity() {
        return eventsCapacity;
    }

    public int getLogsCapacity() {
        return logsCapacity;
    }

    public int getErrorsCapacity() {
        return errorsCapacity;
    }

    public int getOutboundConcurrency() {
        return outboundConcurrency;
    }

    public boolean isWriteAllowed() {
        return writeAllowed;
    }

    public String getProtectedRef() {
        return protectedRef;
    }

    public WriteGatePolicy getWriteGatePolicy() {
        return writeGatePolicy;
    }

    public boolean isSchemaValidationEnabled() {
        return schemaValidationEnabled;
    }

    /**
     * Per-call deadline; {@link Duration#ZERO} means none.
     */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Remote mutating tool name to the local-workspace tool that can do the same job.
     */
    public Map<String, String> getLocalFallbacks() {
        return localFallbacks;
    }

    public DedupConfig dedupConfig() {
        return dedupEnabled
                ? new DedupConfig(dedupMaxEntries, dedupTtl, true)
                : DedupConfig.disabled();
    }

    public DiagnosticsConfig diagnosticsConfig() {
        return new DiagnosticsConfig(eventsCapacity, logsCapacity, errorsCapacity);
    }

    public static DispatcherOptions defaults() {
        return builder().build();
    }

    /**
     * Writes allowed, validation off, dedup on: for trusted local automation.
     */
    public static DispatcherOptions permissive() {
        return builder()
                .writeAllowed(true)
                .schemaValidationEnabled(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration dedupTtl = DEFAULT_DEDUP_TTL;
        private boolean dedupEnabled = true;
        private int dedupMaxEntries = DEFAULT_DEDUP_MAX_ENTRIES;
        private int eventsCapacity = DEFAULT_EVENTS_CAPACITY;
        private int logsCapacity = DEFAULT_LOGS_CAPACITY;
        private int errorsCapacity = DEFAULT_ERRORS_CAPACITY;
        private int outboundConcurrency = DEFAULT_OUTBOUND_CONCURRENCY;
        private boolean writeAllowed = false;
        private String protectedRef = "main";
        private WriteGatePolicy writeGatePolicy = WriteGatePolicy.PROTECTED_REF;
        private boolean schemaValidationEnabled = true;
        private Duration callTimeout = Duration.ZERO;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private final Map<String, String> localFallbacks = new LinkedHashMap<>();

        public Builder dedupTtl(Duration dedupTtl) {
            if (dedupTtl == null || dedupTtl.isNegative()) {
                throw new IllegalArgumentException("dedupTtl must be >= 0");
            }
            this.dedupTtl = dedupTtl;
            return this;
        }

        public Builder dedupEnabled(boolean dedupEnabled) {
            this.dedupEnabled = dedupEnabled;
            return this;
        }

        public Builder dedupMaxEntries(int dedupMaxEntries) {
            if (dedupMaxEntries <= 0) {
                throw new IllegalArgumentException("dedupMaxEntries must be positive");
            }
            this.dedupMaxEntries = dedupMaxEntries;
            return this;
        }

        /**
         * Capacity of the call-event buffer; 0 or less means unbounded.
         */
        public Builder eventsCapacity(int eventsCapacity) {
            this.eventsCapacity = eventsCapacity;
            return this;
        }

        public Builder logsCapacity(int logsCapacity) {
            this.logsCapacity = logsCapacity;
            return this;
        }

        public Builder errorsCapacity(int errorsCapacity) {
            this.errorsCapacity = errorsCapacity;
            return this;
        }

        public Builder outboundConcurrency(int outboundConcurrency) {
            if (outboundConcurrency <= 0) {
                throw new IllegalArgumentException("outboundConcurrency must be positive");
            }
            this.outboundConcurrency = outboundConcurrency;
            return this;
        }

        public Builder writeAllowed(boolean writeAllowed) {
            this.writeAllowed = writeAllowed;
            return this;
        }

        public Builder protectedRef(String protectedRef) {
            if (protectedRef == null || protectedRef.isBlank()) {
                throw new IllegalArgumentException("protectedRef must not be blank");
            }
            this.protectedRef = protectedRef;
            return this;
        }

        public Builder writeGatePolicy(WriteGatePolicy writeGatePolicy) {
            if (writeGatePolicy == null) {
                throw new IllegalArgumentException("writeGatePolicy is required");
            }
            this.writeGatePolicy = writeGatePolicy;
            return this;
        }

        public Builder schemaValidationEnabled(boolean schemaValidationEnabled) {
            this.schemaValidationEnabled = schemaValidationEnabled;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            if (callTimeout == null || callTimeout.isNegative()) {
                throw new IllegalArgumentException("callTimeout must be >= 0");
            }
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder localFallback(String remoteTool, String localTool) {
            this.localFallbacks.put(remoteTool, localTool);
            return this;
        }

        public DispatcherOptions build() {
            return new DispatcherOptions(this);
        }
    }
}
