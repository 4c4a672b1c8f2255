package com.bel.graph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A modifier attached to a gene, RNA, miRNA or protein: a protein or gene modification,
 * an HGVS variant, a fragment, or a cellular location.
 *
 * @param type      the kind of modifier
 * @param arguments canonical rendered arguments, in order
 */
public record Variant(Type type, List<String> arguments) implements Comparable<Variant> {

    public enum Type {
        PMOD("pmod"),
        GMOD("gmod"),
        HGVS("var"),
        FRAGMENT("frag"),
        LOCATION("loc");

        private final String keyword;

        Type(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    public Variant {
        Objects.requireNonNull(type, "type is required");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public static Variant proteinModification(Identifier modification, String aminoAcid, String position) {
        if (aminoAcid == null) {
            return new Variant(Type.PMOD, List.of(modification.toBelOmittingDefault()));
        }
        if (position == null) {
            return new Variant(Type.PMOD, List.of(modification.toBelOmittingDefault(), aminoAcid));
        }
        return new Variant(Type.PMOD, List.of(modification.toBelOmittingDefault(), aminoAcid, position));
    }

    public static Variant geneModification(Identifier modification) {
        return new Variant(Type.GMOD, List.of(modification.toBelOmittingDefault()));
    }

    public static Variant hgvs(String description) {
        return new Variant(Type.HGVS, List.of(Identifier.quote(description)));
    }

    public static Variant fragment(String range, String description) {
        if (description == null) {
            return new Variant(Type.FRAGMENT, List.of(Identifier.quote(range)));
        }
        return new Variant(Type.FRAGMENT, List.of(Identifier.quote(range), Identifier.quote(description)));
    }

    public static Variant location(Identifier location) {
        return new Variant(Type.LOCATION, List.of(location.toBel()));
    }

    public String toBel() {
        return type.getKeyword() + "(" + String.join(", ", arguments) + ")";
    }

    @Override
    public int compareTo(Variant other) {
        return toBel().compareTo(other.toBel());
    }

    @Override
    public String toString() {
        return toBel();
    }
}
