package com.tool.invocation.upstream;

import com.tool.invocation.error.Classification;
import com.tool.invocation.error.ErrorCategory;
import com.tool.invocation.error.ErrorClassifier;
import com.tool.invocation.error.UpstreamException;
import com.tool.invocation.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Caps the number of simultaneous requests to external collaborators, regardless of how many
 * calls are in flight, and records per-dependency request metrics.
 *
 * <p>{@link #call(String, Callable)} blocks the calling worker until a permit is free;
 * {@link #callAsync(String, Supplier)} queues the work instead and starts it when a permit is released.</p>
 */
public class OutboundLimiter {

    private static final Logger log = LoggerFactory.getLogger(OutboundLimiter.class);

    private final Semaphore permits;
    private final int maxConcurrency;
    private final MetricsService metrics;
    private final ErrorClassifier classifier = new ErrorClassifier();
    private final Queue<Runnable> waiting = new ConcurrentLinkedQueue<>();

    public OutboundLimiter(int maxConcurrency, MetricsService metrics) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        this.maxConcurrency = maxConcurrency;
        this.permits = new Semaphore(maxConcurrency, true);
        this.metrics = metrics;
    }

    public <T> T call(String dependency, Callable<T> work) throws Exception {
        permits.acquire();
        try {
            T result = work.call();
            record(dependency, null);
            return result;
        } catch (Exception e) {
            record(dependency, e);
            throw e;
        } finally {
            permits.release();
        }
    }

    public <T> CompletableFuture<T> callAsync(String dependency, Supplier<? extends CompletionStage<T>> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        waiting.add(() -> {
            if (result.isDone()) {
                releaseAndDrain();
                return;
            }
            CompletionStage<T> stage;
            try {
                stage = work.get();
            } catch (RuntimeException e) {
                stage = CompletableFuture.failedFuture(e);
            }
            stage.whenComplete((value, error) -> {
                record(dependency, error);
                releaseAndDrain();
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(ErrorClassifier.unwrap(error));
                }
            });
        });
        drain();
        return result;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    private void releaseAndDrain() {
        permits.release();
        drain();
    }

    private void drain() {
        while (!waiting.isEmpty() && permits.tryAcquire()) {
            Runnable next = waiting.poll();
            if (next == null) {
                permits.release();
                return;
            }
            next.run();
        }
    }

    private void record(String dependency, Throwable error) {
        if (error == null || ErrorClassifier.isCancellation(error)) {
            metrics.recordUpstreamRequest(dependency, false, false, false);
            return;
        }
        Throwable cause = ErrorClassifier.unwrap(error);
        Classification classification = classifier.classify(cause);
        boolean rateLimited = cause instanceof UpstreamException upstream && upstream.isRateLimited();
        boolean timedOut = classification.category() == ErrorCategory.TIMEOUT;
        log.debug("upstream.failed dependency={} category={} rateLimited={}", dependency,
                classification.category().wireName(), rateLimited);
        metrics.recordUpstreamRequest(dependency, true, rateLimited, timedOut);
    }
}
