package com.bel.graph.namespace;

import java.time.Duration;
import java.util.Objects;

/**
 * Size and lifetime of cached resolver answers.
 *
 * @param maximumSize      entries kept before the least used are evicted
 * @param expireAfterWrite how long an answer stays valid, so edited namespace resources are picked up
 * @param enabled          {@code false} to send every lookup to the delegate
 */
public record ResolverCacheConfig(long maximumSize, Duration expireAfterWrite, boolean enabled) {

    private static final ResolverCacheConfig DEFAULTS =
            new ResolverCacheConfig(100_000, Duration.ofHours(1), true);

    public ResolverCacheConfig {
        Objects.requireNonNull(expireAfterWrite, "expireAfterWrite is required");
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive: " + maximumSize);
        }
        if (expireAfterWrite.isZero() || expireAfterWrite.isNegative()) {
            throw new IllegalArgumentException("expireAfterWrite must be positive: " + expireAfterWrite);
        }
    }

    public static ResolverCacheConfig defaults() {
        return DEFAULTS;
    }

    public static ResolverCacheConfig disabled() {
        return new ResolverCacheConfig(DEFAULTS.maximumSize, DEFAULTS.expireAfterWrite, false);
    }
}
