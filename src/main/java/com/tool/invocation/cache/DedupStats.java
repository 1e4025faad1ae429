package com.tool.invocation.cache;

/**
 * Dedup cache counters.
 *
 * @param hitCount          calls that attached to an existing entry
 * @param missCount         calls that started the work themselves
 * @param failureCount      shared computations that failed (and were evicted)
 * @param cancellationCount shared computations cancelled by their owner (and evicted)
 * @param size              current number of entries, pending or settled
 */
public record DedupStats(long hitCount, long missCount, long failureCount, long cancellationCount, long size) {

    /**
     * Returns the fraction of calls that were coalesced (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static DedupStats empty() {
        return new DedupStats(0, 0, 0, 0, 0);
    }
}
