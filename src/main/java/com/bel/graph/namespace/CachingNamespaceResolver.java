package com.bel.graph.namespace;

import com.bel.graph.metrics.MetricsService;
import com.bel.graph.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Caffeine-backed decorator that memoizes resolver lookups.
 *
 * <p>Only definitive answers are cached. A delegate failure propagates to the caller
 * (the term parser turns it into a warning) and is retried on the next lookup.</p>
 */
public class CachingNamespaceResolver implements NamespaceResolver {
    private static final Logger log = LoggerFactory.getLogger(CachingNamespaceResolver.class);

    private final NamespaceResolver delegate;
    private final Cache<CacheKey, Resolution> cache;
    private final boolean enabled;
    private final MetricsService metrics;

    public CachingNamespaceResolver(NamespaceResolver delegate, ResolverCacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingNamespaceResolver(NamespaceResolver delegate, ResolverCacheConfig config, MetricsService metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.enabled = config.enabled();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maximumSize())
                .expireAfterWrite(config.expireAfterWrite())
                .recordStats()
                .build();
        log.info("resolver.cache.created maximumSize={} expireAfterWrite={} enabled={}",
                config.maximumSize(), config.expireAfterWrite(), config.enabled());
    }

    @Override
    public Resolution resolve(String namespace, String name) {
        if (!enabled) {
            return delegate.resolve(namespace, name);
        }
        CacheKey key = new CacheKey(namespace, name);
        Resolution cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordResolverCacheHit();
            return cached;
        }
        metrics.recordResolverCacheMiss();
        Resolution resolution = delegate.resolve(namespace, name);
        if (resolution != null) {
            cache.put(key, resolution);
        }
        return resolution;
    }

    @Override
    public Optional<Set<String>> namespaceTerms(String namespace) {
        return delegate.namespaceTerms(namespace);
    }

    /**
     * Drops every cached entry of one namespace, e.g. after its resource was updated.
     */
    public void invalidateNamespace(String namespace) {
        cache.asMap().keySet().removeIf(key -> key.namespace().equals(namespace));
        log.debug("resolver.cache.invalidated namespace={}", namespace);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("resolver.cache.invalidated namespace=ALL");
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(caffeineStats.hitCount(), caffeineStats.missCount(), cache.estimatedSize());
    }

    record CacheKey(String namespace, String name) {}
}
