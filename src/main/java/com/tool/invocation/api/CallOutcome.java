package com.tool.invocation.api;

import java.util.concurrent.CancellationException;

/**
 * Result channel of one execution. Cancellation has its own case so it is never handled by the
 * code that classifies business errors.
 */
sealed interface CallOutcome {

    record Success(Object value) implements CallOutcome {}

    record BusinessError(Throwable error) implements CallOutcome {}

    record Cancelled(CancellationException cause) implements CallOutcome {}
}
