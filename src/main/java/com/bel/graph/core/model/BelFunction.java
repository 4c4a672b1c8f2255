package com.bel.graph.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * BEL term functions, indexed by both their long and short keywords.
 */
public enum BelFunction {
    ABUNDANCE("abundance", "a", Kind.ENTITY),
    PROTEIN("proteinAbundance", "p", Kind.ENTITY),
    GENE("geneAbundance", "g", Kind.ENTITY),
    RNA("rnaAbundance", "r", Kind.ENTITY),
    MIRNA("microRNAAbundance", "m", Kind.ENTITY),
    POPULATION("populationAbundance", "pop", Kind.ENTITY),
    BIOLOGICAL_PROCESS("biologicalProcess", "bp", Kind.PROCESS),
    PATHOLOGY("pathology", "path", Kind.PROCESS),
    COMPLEX("complexAbundance", "complex", Kind.LIST),
    COMPOSITE("compositeAbundance", "composite", Kind.LIST),
    ACTIVITY("activity", "act", Kind.ACTIVITY),
    REACTION("reaction", "rxn", Kind.REACTION),
    TRANSLOCATION("translocation", "tloc", Kind.TRANSLOCATION),
    CELL_SECRETION("cellSecretion", "sec", Kind.TRANSFORMATION),
    CELL_SURFACE_EXPRESSION("cellSurfaceExpression", "surf", Kind.TRANSFORMATION),
    DEGRADATION("degradation", "deg", Kind.TRANSFORMATION);

    /**
     * Structural family of a function, which decides its argument grammar.
     */
    public enum Kind {
        ENTITY,
        PROCESS,
        LIST,
        ACTIVITY,
        REACTION,
        TRANSLOCATION,
        TRANSFORMATION
    }

    private static final Map<String, BelFunction> BY_KEYWORD;

    static {
        Map<String, BelFunction> map = new HashMap<>();
        for (BelFunction function : values()) {
            map.put(function.longName, function);
            map.put(function.shortName, function);
        }
        BY_KEYWORD = Collections.unmodifiableMap(map);
    }

    private final String longName;
    private final String shortName;
    private final Kind kind;

    BelFunction(String longName, String shortName, Kind kind) {
        this.longName = longName;
        this.shortName = shortName;
        this.kind = kind;
    }

    public String getLongName() {
        return longName;
    }

    public String getShortName() {
        return shortName;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Whether variants ({@code pmod}, {@code var}, {@code frag}, ...) may follow the identifier.
     */
    public boolean acceptsVariants() {
        return this == PROTEIN || this == GENE || this == RNA || this == MIRNA;
    }

    /**
     * Whether the function denotes a physical abundance (as opposed to a process or an activity).
     */
    public boolean isAbundance() {
        return kind == Kind.ENTITY || kind == Kind.LIST;
    }

    public static Optional<BelFunction> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }
}
