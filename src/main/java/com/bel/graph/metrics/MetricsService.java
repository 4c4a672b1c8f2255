package com.bel.graph.metrics;

import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.WarningKind;

import java.time.Duration;

/**
 * Interface for recording parsing metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordParseDuration(Duration duration);

    void recordLinesProcessed(long lines);

    void incrementNodeRegistered();

    void incrementEdgeAdded(Relation relation);

    void incrementWarning(WarningKind kind);

    void recordResolverCacheHit();

    void recordResolverCacheMiss();
}
