package com.bel.graph.core.model;

import java.util.Objects;

/**
 * A named abundance or process, e.g. {@code p(HGNC:AKT1)} or {@code bp(GOBP:apoptosis)}.
 */
public record EntityTerm(BelFunction function, Identifier identifier) implements Term {

    public EntityTerm {
        Objects.requireNonNull(function, "function is required");
        Objects.requireNonNull(identifier, "identifier is required");
    }

    @Override
    public String toBel() {
        return function.getShortName() + "(" + identifier.toBel() + ")";
    }

    @Override
    public String toString() {
        return toBel();
    }
}
