package com.tool.invocation.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Caffeine-backed {@link DedupCache}.
 *
 * <p>Each entry is a future that settles to the work's result together with the TTL it was
 * requested with; a per-entry {@link Expiry} keeps pending entries alive and expires settled ones
 * after their TTL. Failures and cancellations evict the entry before the future is completed,
 * so no caller, including callbacks registered on the result, can observe a failed entry
 * still being served.</p>
 */
public class CaffeineDedupCache implements DedupCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineDedupCache.class);

    private final AsyncCache<DedupKey, Settled> cache;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder cancellations = new LongAdder();

    public CaffeineDedupCache(DedupConfig config) {
        this(config, Ticker.systemTicker());
    }

    public CaffeineDedupCache(DedupConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfter(new SettledExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .buildAsync();
        log.info("CaffeineDedupCache initialized: maxEntries={}, ttl={}ms",
                config.maxEntries(), config.ttl().toMillis());
    }

    @Override
    public <T> CompletableFuture<T> runDeduped(Object scheduler, String fingerprint,
                                               Supplier<? extends CompletionStage<T>> work, Duration ttl) {
        Objects.requireNonNull(scheduler, "scheduler is required");
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        Objects.requireNonNull(work, "work is required");
        Duration effectiveTtl = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;

        DedupKey key = new DedupKey(scheduler, fingerprint);
        AtomicBoolean owner = new AtomicBoolean();
        CompletableFuture<Settled> cell = cache.get(key, (k, executor) -> {
            owner.set(true);
            return new CompletableFuture<>();
        });

        CompletableFuture<T> view = new CompletableFuture<>();
        if (owner.get()) {
            misses.increment();
            runOwned(key, cell, work, effectiveTtl, view);
        } else {
            hits.increment();
            log.debug("dedup.attached fingerprint={}", fingerprint);
            attach(key, cell, work, effectiveTtl, view);
        }
        return view;
    }

    private <T> void runOwned(DedupKey key, CompletableFuture<Settled> cell,
                              Supplier<? extends CompletionStage<T>> work, Duration ttl,
                              CompletableFuture<T> view) {
        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(work.get(), "work returned a null stage");
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        CompletionStage<T> started = stage;

        // Forward the settled cell to the owner before the work can complete, so an
        // owner-side cancellation is always observed through the view.
        cell.whenComplete((settled, error) -> {
            if (error == null) {
                @SuppressWarnings("unchecked")
                T value = (T) settled.value();
                view.complete(value);
            } else {
                view.completeExceptionally(unwrap(error));
            }
        });
        view.whenComplete((value, error) -> {
            if (view.isCancelled()) {
                evictCancelled(key, cell);
                cancelStage(started);
            }
        });

        started.whenComplete((value, error) -> {
            if (error == null) {
                if (ttl.isZero()) {
                    cache.asMap().remove(key, cell);
                }
                cell.complete(new Settled(value, ttl));
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                evictCancelled(key, cell);
            } else {
                failures.increment();
                cache.asMap().remove(key, cell);
                log.debug("dedup.evicted.failure fingerprint={} error={}", key.fingerprint(),
                        cause.getClass().getSimpleName());
                cell.completeExceptionally(cause);
            }
        });
    }

    private <T> void attach(DedupKey key, CompletableFuture<Settled> cell,
                            Supplier<? extends CompletionStage<T>> work, Duration ttl,
                            CompletableFuture<T> view) {
        cell.whenComplete((settled, error) -> {
            if (view.isDone()) {
                return;
            }
            if (error == null) {
                @SuppressWarnings("unchecked")
                T value = (T) settled.value();
                view.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (!(cause instanceof CancellationException)) {
                view.completeExceptionally(cause);
                return;
            }
            // The owner gave up; this caller did not, so it runs the work itself.
            log.debug("dedup.restart fingerprint={}", key.fingerprint());
            CompletableFuture<T> retry = runDeduped(key.scheduler(), key.fingerprint(), work, ttl);
            retry.whenComplete((value, retryError) -> {
                if (retryError == null) {
                    view.complete(value);
                } else {
                    view.completeExceptionally(unwrap(retryError));
                }
            });
            view.whenComplete((value, viewError) -> {
                if (view.isCancelled()) {
                    retry.cancel(true);
                }
            });
        });
    }

    private void evictCancelled(DedupKey key, CompletableFuture<Settled> cell) {
        if (cache.asMap().remove(key, cell)) {
            cancellations.increment();
            log.debug("dedup.evicted.cancelled fingerprint={}", key.fingerprint());
        }
        cell.completeExceptionally(new CancellationException("Shared call was cancelled by its owner"));
    }

    private static void cancelStage(CompletionStage<?> stage) {
        if (stage instanceof Future<?> future) {
            future.cancel(true);
        }
    }

    @Override
    public void invalidateAll(Object scheduler) {
        boolean removed = cache.asMap().entrySet().removeIf(entry ->
                entry.getKey().scheduler() == scheduler
                        && entry.getValue().isDone()
                        && !entry.getValue().isCompletedExceptionally());
        if (removed) {
            log.debug("dedup.invalidated scheduler={}", scheduler);
        }
    }

    @Override
    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.debug("Invalidated all dedup entries");
    }

    @Override
    public DedupStats getStats() {
        return new DedupStats(hits.sum(), misses.sum(), failures.sum(), cancellations.sum(),
                cache.synchronous().estimatedSize());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Entry key. Schedulers compare by identity.
     */
    record DedupKey(Object scheduler, String fingerprint) {

        @Override
        public boolean equals(Object o) {
            return o instanceof DedupKey other
                    && other.scheduler == scheduler
                    && other.fingerprint.equals(fingerprint);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(scheduler) + fingerprint.hashCode();
        }
    }

    record Settled(Object value, Duration ttl) {}

    private static final class SettledExpiry implements Expiry<DedupKey, Settled> {

        @Override
        public long expireAfterCreate(DedupKey key, Settled value, long currentTime) {
            return saturatedNanos(value.ttl());
        }

        @Override
        public long expireAfterUpdate(DedupKey key, Settled value, long currentTime, long currentDuration) {
            return saturatedNanos(value.ttl());
        }

        @Override
        public long expireAfterRead(DedupKey key, Settled value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long saturatedNanos(Duration ttl) {
            try {
                return ttl.toNanos();
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }
}
