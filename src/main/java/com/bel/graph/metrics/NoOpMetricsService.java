package com.bel.graph.metrics;

import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.WarningKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordParseDuration(Duration duration) {
    }

    @Override
    public void recordLinesProcessed(long lines) {
    }

    @Override
    public void incrementNodeRegistered() {
    }

    @Override
    public void incrementEdgeAdded(Relation relation) {
    }

    @Override
    public void incrementWarning(WarningKind kind) {
    }

    @Override
    public void recordResolverCacheHit() {
    }

    @Override
    public void recordResolverCacheMiss() {
    }
}
