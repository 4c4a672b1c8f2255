package com.bel.graph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The molecular activity of an abundance, e.g. {@code act(p(HGNC:AKT1), ma(kin))}.
 * The effect is {@code null} for an unspecified activity.
 */
public record ActivityTerm(Term target, Identifier effect) implements Term {

    public ActivityTerm {
        Objects.requireNonNull(target, "target is required");
    }

    @Override
    public BelFunction function() {
        return BelFunction.ACTIVITY;
    }

    public Optional<Identifier> getEffect() {
        return Optional.ofNullable(effect);
    }

    @Override
    public String toBel() {
        if (effect == null) {
            return "act(" + target.toBel() + ")";
        }
        return "act(" + target.toBel() + ", ma(" + effect.toBelOmittingDefault() + "))";
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
