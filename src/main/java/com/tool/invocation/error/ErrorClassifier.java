package com.tool.invocation.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised during a call onto an {@link ErrorCategory} and {@link ErrorOrigin}.
 *
 * <p>Cancellation is not a failure and must never reach this class; passing a
 * {@link CancellationException} is rejected.</p>
 */
public class ErrorClassifier {

    private static final int MAX_MESSAGE_LENGTH = 2_000;

    /**
     * Message fragments that indicate the call was rejected by the hosting platform or
     * connector before it reached this server's own logic.
     */
    private static final List<String> EXTERNAL_PLATFORM_MARKERS = List.of(
            "connector",
            "platform",
            "blocked by",
            "request was rejected before",
            "clientresponseerror",
            "upstream connect error",
            "safety check",
            "content policy",
            "tool call was not delivered"
    );

    /**
     * Classifies a failure.
     *
     * @throws IllegalArgumentException if {@code error} is a cancellation
     */
    public Classification classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            throw new IllegalArgumentException("Cancellation is not classified as a failure", cause);
        }

        String message = describe(cause);
        ErrorCategory category = categoryOf(cause);
        ErrorOrigin origin = originOf(cause, message);
        boolean retryable = cause instanceof ToolInvocationException tie
                ? tie.isRetryable()
                : category == ErrorCategory.TIMEOUT || category == ErrorCategory.UPSTREAM;
        return new Classification(category, origin, message, retryable);
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns true when the throwable, once unwrapped, is a cancellation signal.
     */
    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    private ErrorCategory categoryOf(Throwable cause) {
        if (cause instanceof ToolInvocationException tie) {
            return tie.getCategory();
        }
        if (cause instanceof TimeoutException || hasTimeoutInChain(cause)) {
            return ErrorCategory.TIMEOUT;
        }
        if (cause instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return ErrorCategory.UPSTREAM;
        }
        return ErrorCategory.UNKNOWN;
    }

    private ErrorOrigin originOf(Throwable cause, String message) {
        if (cause instanceof ToolInvocationException tie && tie.getOriginHint() != null) {
            return tie.getOriginHint();
        }
        String lowered = message.toLowerCase(Locale.ROOT);
        for (String marker : EXTERNAL_PLATFORM_MARKERS) {
            if (lowered.contains(marker)) {
                return ErrorOrigin.EXTERNAL_PLATFORM;
            }
        }
        return ErrorOrigin.INTERNAL;
    }

    private static boolean hasTimeoutInChain(Throwable cause) {
        Throwable current = cause;
        int depth = 0;
        while (current != null && depth++ < 8) {
            if (current instanceof TimeoutException || current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Single-line, bounded description of the exception.
     */
    static String describe(Throwable cause) {
        String raw = cause.getMessage();
        if (raw == null || raw.isBlank()) {
            raw = cause.getClass().getSimpleName();
        }
        String single = raw.replaceAll("\\s+", " ").trim();
        if (single.length() > MAX_MESSAGE_LENGTH) {
            single = single.substring(0, MAX_MESSAGE_LENGTH) + "...(truncated)";
        }
        return single;
    }
}
