package com.tool.invocation.cache;

import java.time.Duration;

/**
 * Configuration for the dedup cache.
 *
 * @param maxEntries maximum number of entries kept
 * @param ttl        how long a successful result keeps absorbing repeats; zero coalesces in-flight calls only
 * @param enabled    whether calls are coalesced at all
 */
public record DedupConfig(int maxEntries, Duration ttl, boolean enabled) {

    public DedupConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
    }

    /**
     * Default configuration: 10,000 entries, 5s TTL, enabled.
     */
    public static DedupConfig defaults() {
        return new DedupConfig(10_000, Duration.ofSeconds(5), true);
    }

    public static DedupConfig disabled() {
        return new DedupConfig(1, Duration.ZERO, false);
    }
}
