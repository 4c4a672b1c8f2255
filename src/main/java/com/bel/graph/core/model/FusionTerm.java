package com.bel.graph.core.model;

import java.util.Objects;

/**
 * A fusion of two genes, RNAs or proteins, e.g.
 * {@code p(fus(HGNC:BCR, "p.1_426", HGNC:JAK2, "p.812_1132"))}.
 *
 * <p>An unknown breakpoint range is recorded as {@code "?"}.</p>
 */
public record FusionTerm(BelFunction function,
                         Identifier partner5,
                         String range5,
                         Identifier partner3,
                         String range3) implements Term {

    public static final String UNKNOWN_RANGE = "?";

    public FusionTerm {
        Objects.requireNonNull(function, "function is required");
        Objects.requireNonNull(partner5, "partner5 is required");
        Objects.requireNonNull(partner3, "partner3 is required");
        range5 = range5 != null ? range5 : UNKNOWN_RANGE;
        range3 = range3 != null ? range3 : UNKNOWN_RANGE;
    }

    @Override
    public String toBel() {
        return function.getShortName() + "(fus(" + partner5.toBel() + ", " + Identifier.quote(range5) + ", "
                + partner3.toBel() + ", " + Identifier.quote(range3) + "))";
    }

    @Override
    public String toString() {
        return toBel();
    }
}
