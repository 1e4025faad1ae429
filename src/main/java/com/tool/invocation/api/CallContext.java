package com.tool.invocation.api;

import com.tool.invocation.gate.TargetRefExtractor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-call state owned by the dispatcher for the lifetime of one call.
 */
public final class CallContext {

    private final String callId;
    private final String requestedName;
    private final String toolName;
    private final boolean mutating;
    private final Map<String, Object> arguments;
    private final String targetRef;
    private final List<String> targetRefs;
    private final String targetPath;
    private final Instant startTime;
    private final AtomicBoolean recorded = new AtomicBoolean();

    CallContext(String callId, String requestedName, String toolName, boolean mutating,
                Map<String, Object> arguments, Instant startTime) {
        this.callId = callId;
        this.requestedName = requestedName;
        this.toolName = toolName;
        this.mutating = mutating;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        TargetRefExtractor.Target target = TargetRefExtractor.extract(this.arguments);
        this.targetRef = target.ref();
        this.targetRefs = target.refs();
        this.targetPath = target.path();
        this.startTime = startTime;
    }

    public String callId() {
        return callId;
    }

    /**
     * Name as sent by the caller, before tolerant lookup.
     */
    public String requestedName() {
        return requestedName;
    }

    public String toolName() {
        return toolName;
    }

    public boolean mutating() {
        return mutating;
    }

    public Map<String, Object> arguments() {
        return arguments;
    }

    public String targetRef() {
        return targetRef;
    }

    /**
     * Every ref the call names, primary first.
     */
    public List<String> targetRefs() {
        return targetRefs;
    }

    public String targetPath() {
        return targetPath;
    }

    public Instant startTime() {
        return startTime;
    }

    /**
     * Returns true exactly once; guards the single diagnostics/metrics record of the call.
     */
    boolean markRecorded() {
        return recorded.compareAndSet(false, true);
    }
}
