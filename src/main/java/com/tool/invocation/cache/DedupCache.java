package com.tool.invocation.cache;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Coalesces concurrent calls that share a fingerprint into one execution.
 *
 * <p>Entries are scoped to a scheduler: the executor a dispatcher runs its calls on. Callers on
 * different schedulers never share an entry, even for the same fingerprint.</p>
 */
public interface DedupCache {

    /**
     * Runs {@code work} unless a live entry for {@code (scheduler, fingerprint)} exists, in which case
     * the caller attaches to that entry's result.
     *
     * <ul>
     *   <li>a successful result stays cached for {@code ttl}</li>
     *   <li>a failed result is evicted before any caller observes the failure</li>
     *   <li>cancelling the returned future of the caller that started the work evicts the entry and
     *       cancels the work; attached callers then start the work again themselves</li>
     *   <li>cancelling the returned future of an attached caller only detaches that caller</li>
     * </ul>
     */
    <T> CompletableFuture<T> runDeduped(Object scheduler, String fingerprint,
                                        Supplier<? extends CompletionStage<T>> work, Duration ttl);

    /**
     * Evicts the settled results of one scheduler; in-flight entries keep coalescing.
     */
    void invalidateAll(Object scheduler);

    void invalidateAll();

    DedupStats getStats();
}
