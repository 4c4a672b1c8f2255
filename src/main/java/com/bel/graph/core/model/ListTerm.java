package com.bel.graph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A complex or composite abundance built from member terms. Member order carries no
 * meaning, so members are sorted and de-duplicated.
 */
public record ListTerm(BelFunction function, List<Term> members) implements Term {

    public ListTerm {
        Objects.requireNonNull(function, "function is required");
        if (function.getKind() != BelFunction.Kind.LIST) {
            throw new IllegalArgumentException("not a list function: " + function);
        }
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("at least one member is required");
        }
        members = Term.normalize(members);
    }

    @Override
    public String toBel() {
        return function.getShortName() + "(" + Term.render(members) + ")";
    }

    @Override
    public List<Term> children() {
        return members;
    }

    @Override
    public String toString() {
        return toBel();
    }
}
