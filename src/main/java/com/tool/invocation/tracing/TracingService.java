package com.tool.invocation.tracing;

import java.util.Map;

/**
 * Starts spans for tool calls. The default {@link NoOpTracingService} does nothing, so the library
 * works without any tracing dependency on the classpath.
 */
public interface TracingService {

    String TOOL_CALL_SPAN = "tool.call";

    CallSpan startSpan(String operationName, Map<String, String> attributes);
}
