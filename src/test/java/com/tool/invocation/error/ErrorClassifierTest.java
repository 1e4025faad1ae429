package com.tool.invocation.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorClassifier Tests")
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Nested
    @DisplayName("Categories")
    class CategoryTests {

        @Test
        @DisplayName("Invocation exceptions keep their own category and retryability")
        void invocationExceptions() {
            Classification validation = classifier.classify(
                    new ToolValidationException("Invalid arguments", List.of("missing: owner")));
            Classification timeout = classifier.classify(new ToolTimeoutException("slow", Duration.ofMillis(50)));

            assertEquals(ErrorCategory.VALIDATION, validation.category());
            assertFalse(validation.retryable());
            assertEquals(ErrorCategory.TIMEOUT, timeout.category());
            assertTrue(timeout.retryable());
            assertEquals("Tool 'slow' did not complete within 50ms", timeout.message());
        }

        @Test
        @DisplayName("Upstream status codes drive retryability")
        void upstream() {
            assertTrue(classifier.classify(new UpstreamException("github", "Server error", 502)).retryable());
            assertTrue(classifier.classify(new UpstreamException("github", "Slow down", 429)).retryable());
            assertFalse(classifier.classify(new UpstreamException("github", "Not found", 404)).retryable());
            assertEquals(ErrorCategory.UPSTREAM,
                    classifier.classify(new UpstreamException("github", "Not found", 404)).category());
        }

        @Test
        @DisplayName("Standard exceptions map by type")
        void standardExceptions() {
            assertEquals(ErrorCategory.TIMEOUT, classifier.classify(new TimeoutException("late")).category());
            assertEquals(ErrorCategory.VALIDATION,
                    classifier.classify(new IllegalArgumentException("bad input")).category());
            assertEquals(ErrorCategory.UPSTREAM, classifier.classify(new IOException("connection reset")).category());
            assertEquals(ErrorCategory.UNKNOWN, classifier.classify(new IllegalStateException("bug")).category());
        }

        @Test
        @DisplayName("A socket timeout anywhere in the cause chain is a timeout")
        void timeoutInChain() {
            IOException wrapped = new IOException("read failed", new SocketTimeoutException("Read timed out"));

            Classification classification = classifier.classify(wrapped);

            assertEquals(ErrorCategory.TIMEOUT, classification.category());
            assertTrue(classification.retryable());
        }

        @Test
        @DisplayName("Unknown failures are not retryable")
        void unknownNotRetryable() {
            assertFalse(classifier.classify(new NullPointerException("x")).retryable());
        }
    }

    @Nested
    @DisplayName("Origin")
    class OriginTests {

        @Test
        @DisplayName("Platform rejection markers mark the origin as external")
        void externalMarkers() {
            Classification classification = classifier.classify(
                    new IllegalStateException("Request was BLOCKED BY the connector safety check"));

            assertEquals(ErrorOrigin.EXTERNAL_PLATFORM, classification.origin());
        }

        @Test
        @DisplayName("Ordinary failures are internal")
        void internal() {
            assertEquals(ErrorOrigin.INTERNAL, classifier.classify(new IllegalStateException("oops")).origin());
        }

        @Test
        @DisplayName("An explicit origin hint wins over the message")
        void hintWins() {
            UpstreamException e = new UpstreamException("github", "platform said no", 0, false,
                    ErrorOrigin.INTERNAL, null);

            assertEquals(ErrorOrigin.INTERNAL, classifier.classify(e).origin());
        }
    }

    @Nested
    @DisplayName("Unwrapping and messages")
    class UnwrapTests {

        @Test
        @DisplayName("Completion and execution wrappers are stripped")
        void unwrap() {
            IOException root = new IOException("down");

            assertSame(root, ErrorClassifier.unwrap(new CompletionException(new ExecutionException(root))));
            assertEquals(ErrorCategory.UPSTREAM, classifier.classify(new CompletionException(root)).category());
        }

        @Test
        @DisplayName("Cancellation is rejected, wrapped or not")
        void cancellationRejected() {
            assertThrows(IllegalArgumentException.class, () -> classifier.classify(new CancellationException()));
            assertThrows(IllegalArgumentException.class,
                    () -> classifier.classify(new CompletionException(new CancellationException())));
            assertTrue(ErrorClassifier.isCancellation(new CompletionException(new CancellationException())));
            assertFalse(ErrorClassifier.isCancellation(new IOException()));
        }

        @Test
        @DisplayName("Messages are single-line, bounded and never empty")
        void messages() {
            assertEquals("line one line two",
                    classifier.classify(new IllegalStateException("line one\n  line two")).message());
            assertEquals("IllegalStateException", classifier.classify(new IllegalStateException()).message());

            String longMessage = classifier.classify(new IllegalStateException("x".repeat(5_000))).message();
            assertTrue(longMessage.endsWith("...(truncated)"));
            assertEquals(2_000 + "...(truncated)".length(), longMessage.length());
        }
    }
}
