package com.tool.invocation.diagnostics;

import com.tool.invocation.error.ErrorCategory;
import com.tool.invocation.error.ErrorOrigin;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable entry in one of the diagnostics buffers.
 *
 * @param kind      which buffer the record belongs to
 * @param callId    id of the call that produced the record, may be null for process-level logs
 * @param toolName  tool name, may be null for process-level logs
 * @param timestamp when the record was produced
 * @param status    call phase for events ({@code start}, {@code ok}, {@code error}, {@code cancelled}),
 *                  level for log lines
 * @param message   human-readable text
 * @param category  error category, errors only
 * @param origin    error origin, errors only
 * @param details   additional structured data (argument preview, duration, ...)
 */
public record DiagnosticRecord(
        Kind kind,
        String callId,
        String toolName,
        Instant timestamp,
        String status,
        String message,
        ErrorCategory category,
        ErrorOrigin origin,
        Map<String, Object> details
) {

    public enum Kind { EVENT, LOG, ERROR }

    public DiagnosticRecord {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(status, "status is required");
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /**
     * Returns a copy with the message and all string details scrubbed by {@link Redactor}.
     */
    @SuppressWarnings("unchecked")
    public DiagnosticRecord redacted() {
        return new DiagnosticRecord(kind, callId, toolName, timestamp, status,
                Redactor.redact(message), category, origin,
                (Map<String, Object>) Redactor.redactValue(details));
    }

    /**
     * JSON-friendly view used by the introspection tools.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", kind.name().toLowerCase());
        out.put("call_id", callId);
        out.put("tool", toolName);
        out.put("timestamp", timestamp.toString());
        out.put("status", status);
        out.put("message", message);
        if (category != null) {
            out.put("category", category.wireName());
        }
        if (origin != null) {
            out.put("origin", origin.wireName());
        }
        if (!details.isEmpty()) {
            out.put("details", details);
        }
        return out;
    }

    public static Builder builder(Kind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final Kind kind;
        private String callId;
        private String toolName;
        private Instant timestamp = Instant.now();
        private String status;
        private String message;
        private ErrorCategory category;
        private ErrorOrigin origin;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(Kind kind) {
            this.kind = kind;
        }

        public Builder callId(String callId) {
            this.callId = callId;
            return this;
        }

        public Builder toolName(String toolName) {
            this.toolName = toolName;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder category(ErrorCategory category) {
            this.category = category;
            return this;
        }

        public Builder origin(ErrorOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder details(Map<String, Object> details) {
            if (details != null) {
                this.details.putAll(details);
            }
            return this;
        }

        public DiagnosticRecord build() {
            return new DiagnosticRecord(kind, callId, toolName, timestamp, status, message,
                    category, origin, details);
        }
    }
}
