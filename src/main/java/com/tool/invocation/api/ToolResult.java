package com.tool.invocation.api;

import com.tool.invocation.error.ToolErrorPayload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a dispatched call that was not cancelled: either a value or a structured error.
 *
 * @param callId     unique id of the call
 * @param toolName   resolved tool name, or the requested name when the tool is unknown
 * @param value      the tool's return value, null on error
 * @param error      classified failure, null on success
 * @param durationMs wall-clock duration of the call
 */
public record ToolResult(String callId, String toolName, Object value, ToolErrorPayload error, long durationMs) {

    public static ToolResult success(String callId, String toolName, Object value, long durationMs) {
        return new ToolResult(callId, toolName, value, null, durationMs);
    }

    public static ToolResult failure(String callId, String toolName, ToolErrorPayload error, long durationMs) {
        return new ToolResult(callId, toolName, null, error, durationMs);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * JSON-friendly form handed back to the transport adapter.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", isSuccess());
        out.put("call_id", callId);
        out.put("tool", toolName);
        if (isSuccess()) {
            out.put("result", value);
        } else {
            out.put("error", error.toMap());
        }
        out.put("duration_ms", durationMs);
        return out;
    }
}
