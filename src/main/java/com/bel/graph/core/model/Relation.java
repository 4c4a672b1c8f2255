package com.bel.graph.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * BEL relationship vocabulary.
 *
 * <p>QUALIFIED relations assert evidence-backed causality or correlation and may only be
 * recorded under a citation and evidence. UNQUALIFIED relations express composition or
 * ontology and are context-free.</p>
 */
public enum Relation {
    INCREASES("increases", true, "->"),
    DIRECTLY_INCREASES("directlyIncreases", true, "=>"),
    DECREASES("decreases", true, "-|"),
    DIRECTLY_DECREASES("directlyDecreases", true, "=|"),
    CAUSES_NO_CHANGE("causesNoChange", true, "cnc"),
    REGULATES("regulates", true, "reg"),
    ASSOCIATION("association", true, "--"),
    POSITIVE_CORRELATION("positiveCorrelation", true, "pos"),
    NEGATIVE_CORRELATION("negativeCorrelation", true, "neg"),
    BIOMARKER_FOR("biomarkerFor", true),
    PROGNOSTIC_BIOMARKER_FOR("prognosticBiomarkerFor", true),
    RATE_LIMITING_STEP_OF("rateLimitingStepOf", true),
    SUB_PROCESS_OF("subProcessOf", true),
    ANALOGOUS_TO("analogousTo", true),

    HAS_COMPONENT("hasComponent", false),
    HAS_MEMBER("hasMember", false),
    HAS_VARIANT("hasVariant", false),
    HAS_REACTANT("hasReactant", false),
    HAS_PRODUCT("hasProduct", false),
    IS_A("isA", false),
    PART_OF("partOf", false),
    INCLUDES("includes", false),
    ACTS_IN("actsIn", false),
    TRANSLOCATES("translocates", false),
    TRANSCRIBED_TO("transcribedTo", false, ":>"),
    TRANSLATED_TO("translatedTo", false, ">>"),
    ORTHOLOGOUS("orthologous", false),
    EQUIVALENT_TO("equivalentTo", false);

    private static final Map<String, Relation> BY_KEYWORD;

    static {
        Map<String, Relation> map = new HashMap<>();
        for (Relation relation : values()) {
            map.put(relation.keyword, relation);
            for (String alias : relation.aliases) {
                map.put(alias, relation);
            }
        }
        BY_KEYWORD = Collections.unmodifiableMap(map);
    }

    private final String keyword;
    private final boolean qualified;
    private final List<String> aliases;

    Relation(String keyword, boolean qualified, String... aliases) {
        this.keyword = keyword;
        this.qualified = qualified;
        this.aliases = List.of(aliases);
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Whether recording this relation requires a citation and evidence.
     */
    public boolean isQualified() {
        return qualified;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public static Optional<Relation> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }
}
