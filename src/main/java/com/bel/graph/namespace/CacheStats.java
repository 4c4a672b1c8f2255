package com.bel.graph.namespace;

/**
 * Snapshot of the resolver cache counters.
 */
public record CacheStats(long hits, long misses, long size) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
