package com.bel.graph.metrics;

import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.WarningKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code bel.parse.duration}: Timer</li>
 *   <li>{@code bel.lines.processed}: DistributionSummary</li>
 *   <li>{@code bel.nodes.registered}: Counter</li>
 *   <li>{@code bel.edges.added}: Counter (tag: relation)</li>
 *   <li>{@code bel.warnings}: Counter (tags: kind, category)</li>
 *   <li>{@code bel.resolver.cache.hit}, {@code bel.resolver.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer parseTimer;
    private final DistributionSummary linesSummary;
    private final Counter nodeCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.parseTimer = Timer.builder("bel.parse.duration")
                .description("Duration of document parses")
                .register(registry);
        this.linesSummary = DistributionSummary.builder("bel.lines.processed")
                .description("Logical lines processed per document")
                .register(registry);
        this.nodeCounter = Counter.builder("bel.nodes.registered")
                .description("Number of new nodes added to graphs")
                .register(registry);
        this.cacheHitCounter = Counter.builder("bel.resolver.cache.hit")
                .description("Number of namespace resolver cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("bel.resolver.cache.miss")
                .description("Number of namespace resolver cache misses")
                .register(registry);
    }

    @Override
    public void recordParseDuration(Duration duration) {
        parseTimer.record(duration);
    }

    @Override
    public void recordLinesProcessed(long lines) {
        linesSummary.record(lines);
    }

    @Override
    public void incrementNodeRegistered() {
        nodeCounter.increment();
    }

    @Override
    public void incrementEdgeAdded(Relation relation) {
        String key = "edge:" + relation.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("bel.edges.added")
                        .description("Number of new edges added to graphs")
                        .tag("relation", relation.getKeyword())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementWarning(WarningKind kind) {
        String key = "warning:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("bel.warnings")
                        .description("Number of parse warnings recorded")
                        .tag("kind", kind.name())
                        .tag("category", kind.getCategory().name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordResolverCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordResolverCacheMiss() {
        cacheMissCounter.increment();
    }
}
