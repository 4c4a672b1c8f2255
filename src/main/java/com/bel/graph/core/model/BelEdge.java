package com.bel.graph.core.model;

import java.util.Objects;

/**
 * A directed relation between two nodes, referenced by index.
 *
 * <p>The identity of an edge is {@link #key()}; the line number only records where it
 * was first asserted.</p>
 */
public record BelEdge(int source, int target, Relation relation, Context context, long lineNumber) {

    public BelEdge {
        Objects.requireNonNull(relation, "relation is required");
        context = context != null ? context : Context.empty();
    }

    public Key key() {
        return new Key(source, target, relation, context);
    }

    /**
     * Multigraph identity: two edges with equal keys are the same edge.
     */
    public record Key(int source, int target, Relation relation, Context context) {}
}
