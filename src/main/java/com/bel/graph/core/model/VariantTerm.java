package com.bel.graph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A modified entity: a base gene, RNA, miRNA or protein with one or more variants,
 * e.g. {@code p(HGNC:AKT1, pmod(Ph, Ser, 473))}.
 */
public record VariantTerm(EntityTerm base, List<Variant> variants) implements Term {

    public VariantTerm {
        Objects.requireNonNull(base, "base is required");
        if (variants == null || variants.isEmpty()) {
            throw new IllegalArgumentException("at least one variant is required");
        }
        variants = variants.stream().distinct().sorted().toList();
    }

    @Override
    public BelFunction function() {
        return base.function();
    }

    @Override
    public String toBel() {
        StringBuilder sb = new StringBuilder();
        sb.append(base.function().getShortName()).append('(').append(base.identifier().toBel());
        for (Variant variant : variants) {
            sb.append(", ").append(variant.toBel());
        }
        return sb.append(')').toString();
    }

    @Override
    public List<Term> children() {
        return List.of(base);
    }

    @Override
    public String toString() {
        return toBel();
    }
}
