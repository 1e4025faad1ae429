package com.tool.invocation.cache;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Dedup cache that never coalesces; every call runs its own work.
 * Used when dedup is disabled.
 */
public class NoOpDedupCache implements DedupCache {

    @Override
    public <T> CompletableFuture<T> runDeduped(Object scheduler, String fingerprint,
                                               Supplier<? extends CompletionStage<T>> work, Duration ttl) {
        try {
            return work.get().toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void invalidateAll(Object scheduler) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public DedupStats getStats() {
        return DedupStats.empty();
    }
}
