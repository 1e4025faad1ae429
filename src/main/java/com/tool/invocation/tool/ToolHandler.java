package com.tool.invocation.tool;

/**
 * Synchronous tool implementation. Runs on the dispatcher's worker pool.
 *
 * <p>The returned value must be JSON-serializable (maps, lists, strings, numbers, booleans, records).
 * Throwing signals a business failure; the dispatcher classifies it.</p>
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(ToolArguments args) throws Exception;
}
