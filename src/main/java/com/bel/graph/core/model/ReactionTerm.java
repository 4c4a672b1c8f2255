package com.bel.graph.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A reaction converting reactants into products.
 */
public record ReactionTerm(List<Term> reactants, List<Term> products) implements Term {

    public ReactionTerm {
        reactants = reactants != null ? Term.normalize(reactants) : List.of();
        products = products != null ? Term.normalize(products) : List.of();
    }

    @Override
    public BelFunction function() {
        return BelFunction.REACTION;
    }

    @Override
    public String toBel() {
        return "rxn(reactants(" + Term.render(reactants) + "), products(" + Term.render(products) + "))";
    }

    @Override
    public List<Term> children() {
        List<Term> children = new ArrayList<>(reactants);
        children.addAll(products);
        return List.copyOf(children);
    }

    @Override
    public String toString() {
        return toBel();
    }
}
