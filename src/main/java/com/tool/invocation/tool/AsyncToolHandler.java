package com.tool.invocation.tool;

import java.util.concurrent.CompletionStage;

/**
 * Tool implementation for long-running work. The returned stage completes when the work does;
 * the calling thread is not held while it runs.
 *
 * <p>If the dispatcher cancels the call, it cancels the returned stage when that stage is a
 * {@link java.util.concurrent.Future}. Implementations that start their own I/O should observe it.</p>
 */
@FunctionalInterface
public interface AsyncToolHandler {

    CompletionStage<?> handle(ToolArguments args);
}
