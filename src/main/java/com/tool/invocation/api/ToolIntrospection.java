package com.tool.invocation.api;

import com.tool.invocation.cache.DedupStats;
import com.tool.invocation.diagnostics.DiagnosticRecord;
import com.tool.invocation.diagnostics.RingBuffer;
import com.tool.invocation.gate.WriteGate;
import com.tool.invocation.health.HealthStatus;
import com.tool.invocation.logging.LogContext;
import com.tool.invocation.schema.ValidationResult;
import com.tool.invocation.tool.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Read-only views over a dispatcher's registry, diagnostics, metrics and health, plus the
 * write-authorization toggle. Every method returns JSON-friendly maps and lists.
 */
public class ToolIntrospection {
    private static final Logger log = LoggerFactory.getLogger(ToolIntrospection.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 1_000;

    /** Key of the tool metadata in a {@code describe_tool} result; the rest is the input schema. */
    public static final String TOOL_METADATA_KEY = "x-tool";

    private final ToolDispatcher dispatcher;

    ToolIntrospection(ToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Lists registered tools sorted by name.
     *
     * @param onlyWrite     keep mutating tools only, i.e. the ones subject to the write gate
     * @param onlyRead      keep read-only tools only
     * @param namePrefix    keep names starting with this prefix (case-insensitive); null or blank keeps all
     * @param includeHidden include tools registered with {@link ToolDescriptor.Visibility#HIDDEN}
     * @throws IllegalArgumentException if both {@code onlyWrite} and {@code onlyRead} are set
     */
    public Map<String, Object> listTools(boolean onlyWrite, boolean onlyRead, String namePrefix,
                                         boolean includeHidden) {
        if (onlyWrite && onlyRead) {
            throw new IllegalArgumentException("only_write and only_read cannot both be true");
        }
        String prefix = namePrefix != null && !namePrefix.isBlank()
                ? namePrefix.trim().toLowerCase(Locale.ROOT) : null;
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolDescriptor tool : dispatcher.getRegistry().list()) {
            if (!includeHidden && tool.visibility() == ToolDescriptor.Visibility.HIDDEN) {
                continue;
            }
            if ((onlyWrite && !tool.mutating()) || (onlyRead && tool.mutating())) {
                continue;
            }
            if (prefix != null && !tool.name().toLowerCase(Locale.ROOT).startsWith(prefix)) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", tool.name());
            entry.put("description", tool.description());
            entry.put("mutating", tool.mutating());
            entry.put("schema", tool.schemaSummary());
            tools.add(entry);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("write_actions_enabled", dispatcher.getWriteGate().state().isAllowed());
        out.put("count", tools.size());
        out.put("tools", tools);
        return out;
    }

    public Map<String, Object> listTools() {
        return listTools(false, false, null, false);
    }

    /**
     * The published input schema of one tool ({@code type}, {@code properties}, {@code required}), with
     * the tool's metadata nested under {@value #TOOL_METADATA_KEY}: {@code name}, {@code description},
     * {@code mutating}, {@code visibility}, {@code tags} and {@code schema_hash}.
     *
     * @throws com.tool.invocation.error.ToolValidationException if no tool matches {@code name}
     */
    public Map<String, Object> describeTool(String name) {
        ToolDescriptor tool = resolve(name);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", tool.name());
        metadata.put("description", tool.description());
        metadata.put("mutating", tool.mutating());
        metadata.put("visibility", tool.visibility().name().toLowerCase(Locale.ROOT));
        metadata.put("tags", List.copyOf(tool.tags()));
        metadata.put("schema_hash", tool.schemaHash());

        Map<String, Object> out = new LinkedHashMap<>(tool.schema());
        out.put(TOOL_METADATA_KEY, metadata);
        return out;
    }

    /**
     * Dry-runs normalization and schema validation without executing the tool or touching the gate.
     */
    public Map<String, Object> validateArgs(String name, Map<String, Object> args) {
        ToolDescriptor tool = resolve(name);
        Map<String, Object> schema = tool.schema();
        Map<String, Object> normalized = dispatcher.normalizer().normalize(schema, args != null ? args : Map.of());
        ValidationResult result = dispatcher.validator().validate(schema, normalized);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tool", tool.name());
        out.putAll(result.toMap());
        out.put("normalized_args", normalized);
        return out;
    }

    /**
     * Recent call events, newest first.
     *
     * @param includeSuccess false keeps only failed and cancelled calls
     */
    public Map<String, Object> recentEvents(int limit, boolean includeSuccess) {
        Predicate<DiagnosticRecord> filter = includeSuccess
                ? r -> true
                : r -> !ToolDispatcher.STATUS_OK.equals(r.status());
        Map<String, Object> out = snapshot(dispatcher.getDiagnostics().events(), limit, filter);
        out.put("include_success", includeSuccess);
        return out;
    }

    public Map<String, Object> recentEvents(int limit) {
        return recentEvents(limit, true);
    }

    public Map<String, Object> recentErrors(int limit) {
        return snapshot(dispatcher.getDiagnostics().errors(), limit, r -> true);
    }

    /**
     * Recent mirrored log lines at or above {@code minLevel} ({@code debug}, {@code info}, {@code warn},
     * {@code error}); an unrecognized level is treated as {@code info}.
     */
    public Map<String, Object> recentLogs(int limit, String minLevel) {
        Level threshold = parseLevel(minLevel);
        Map<String, Object> out = snapshot(dispatcher.getDiagnostics().logs(), limit,
                r -> parseLevel(r.status()).toInt() >= threshold.toInt());
        out.put("min_level", threshold.name().toLowerCase(Locale.ROOT));
        return out;
    }

    public Map<String, Object> recentLogs(int limit) {
        return recentLogs(limit, "info");
    }

    /**
     * Sets the write-authorization toggle; affects calls that reach the gate after this returns.
     */
    public Map<String, Object> authorizeMutations(boolean allowed) {
        try (LogContext lc = LogContext.forOperation("authorize_mutations")) {
            dispatcher.getWriteGate().authorize(allowed);
            log.info("Mutations {}", allowed ? "authorized" : "revoked");
        }
        return writeGateStatus();
    }

    public Map<String, Object> metrics() {
        Map<String, Object> out = new LinkedHashMap<>(dispatcher.getMetricsService().snapshot().toMap());
        DedupStats stats = dispatcher.getDedupCache().getStats();
        Map<String, Object> dedup = new LinkedHashMap<>();
        dedup.put("hits", stats.hitCount());
        dedup.put("misses", stats.missCount());
        dedup.put("failures", stats.failureCount());
        dedup.put("cancellations", stats.cancellationCount());
        dedup.put("size", stats.size());
        dedup.put("hit_rate", stats.hitRate());
        out.put("dedup", dedup);
        out.put("diagnostics", dispatcher.getDiagnostics().stats());
        return out;
    }

    public Map<String, Object> serverStatus() {
        HealthStatus health = dispatcher.getHealthChecks().checkAll();
        DispatcherOptions options = dispatcher.getOptions();

        Map<String, Object> outbound = new LinkedHashMap<>();
        outbound.put("max_concurrency", dispatcher.getOutboundLimiter().maxConcurrency());
        outbound.put("available_permits", dispatcher.getOutboundLimiter().availablePermits());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", health.status().name().toLowerCase(Locale.ROOT));
        out.put("health", health.toMap());
        out.put("credential_present", dispatcher.getCredentialProbe().hasCredential());
        out.put("tool_count", dispatcher.getRegistry().size());
        out.put("write_gate", writeGateStatus());
        out.put("dedup_enabled", options.isDedupEnabled());
        out.put("dedup_ttl_ms", options.getDedupTtl().toMillis());
        out.put("schema_validation_enabled", options.isSchemaValidationEnabled());
        out.put("call_timeout_ms", options.getCallTimeout().toMillis());
        out.put("outbound", outbound);
        return out;
    }

    private Map<String, Object> writeGateStatus() {
        WriteGate gate = dispatcher.getWriteGate();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("allowed", gate.state().isAllowed());
        out.put("protected_ref", gate.state().getProtectedRef());
        out.put("policy", gate.policy().name().toLowerCase(Locale.ROOT));
        return out;
    }

    private ToolDescriptor resolve(String name) {
        return dispatcher.getRegistry().find(name).orElseThrow(() -> dispatcher.unknownTool(name));
    }

    private static Map<String, Object> snapshot(RingBuffer<DiagnosticRecord> buffer, int limit,
                                                Predicate<DiagnosticRecord> filter) {
        int effective = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        List<Map<String, Object>> records = new ArrayList<>();
        for (DiagnosticRecord record : buffer.snapshot(Integer.MAX_VALUE)) {
            if (records.size() >= effective) {
                break;
            }
            if (filter.test(record)) {
                records.add(record.toMap());
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("limit", effective);
        out.put("records", records);
        out.put("returned", records.size());
        out.put("size", buffer.size());
        out.put("capacity", buffer.isBounded() ? buffer.capacity() : null);
        out.put("total", buffer.total());
        out.put("dropped", buffer.dropped());
        return out;
    }

    static Level parseLevel(String name) {
        if (name != null) {
            for (Level level : Level.values()) {
                if (level.name().equalsIgnoreCase(name.trim())) {
                    return level;
                }
            }
        }
        return Level.INFO;
    }
}
