package com.bel.graph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Movement of an abundance between cellular locations.
 */
public record TranslocationTerm(Term target, Identifier from, Identifier to) implements Term {

    public TranslocationTerm {
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
    }

    @Override
    public BelFunction function() {
        return BelFunction.TRANSLOCATION;
    }

    @Override
    public String toBel() {
        return "tloc(" + target.toBel() + ", fromLoc(" + from.toBel() + "), toLoc(" + to.toBel() + "))";
    }

    @Override
    public List<Term> children() {
        return List.of(target);
    }

    @Override
    public String toString() {
        return toBel();
    }
}
