package com.bel.graph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single-argument transformation: degradation, cell secretion or cell surface expression.
 */
public record TransformationTerm(BelFunction function, Term target) implements Term {

    public TransformationTerm {
        Objects.requireNonNull(function, "function is required");
        Objects.requireNonNull(target, "target is required");
        if (function.getKind() != BelFunction.Kind.TRANSFORMATION) {
            throw new IllegalArgumentException("not a transformation function: " + function);
        }
    }

    @Override
    public String toBel() {
        return function.getShortName() + "(" + target.toBel() + ")";
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
