package com.bel.graph.parser;

import com.bel.graph.core.model.Identifier;

import java.util.regex.Pattern;

/**
 * Parser policy, fixed at parser construction.
 *
 * @param allowNakedNames    accept names without a namespace prefix, using {@code nakedNamespace}
 * @param allowNested        accept {@code A rel (B rel C)} statements
 * @param citationClearing   setting a citation clears evidence and annotations
 * @param inferImplicitEdges add the context-free edges implied by term structure
 * @param nakedNamespace     placeholder namespace given to naked names
 * @param maxTermDepth       maximum nesting depth of a single term
 */
public record ParserConfig(boolean allowNakedNames,
                           boolean allowNested,
                           boolean citationClearing,
                           boolean inferImplicitEdges,
                           String nakedNamespace,
                           int maxTermDepth) {

    public static final String DEFAULT_NAKED_NAMESPACE = "DIRTY";
    public static final int DEFAULT_MAX_TERM_DEPTH = 32;

    private static final Pattern NAMESPACE_KEYWORD = Pattern.compile("[A-Za-z0-9_]+");

    public ParserConfig {
        if (maxTermDepth < 1) {
            throw new ParserConfigurationException("maxTermDepth must be >= 1, was " + maxTermDepth);
        }
        if (nakedNamespace == null || nakedNamespace.isBlank()) {
            throw new ParserConfigurationException("nakedNamespace must not be blank");
        }
        if (!NAMESPACE_KEYWORD.matcher(nakedNamespace).matches()) {
            throw new ParserConfigurationException(
                    "nakedNamespace must be a namespace keyword, was '" + nakedNamespace + "'");
        }
        if (Identifier.DEFAULT_NAMESPACE.equals(nakedNamespace)) {
            throw new ParserConfigurationException(
                    "nakedNamespace must not be the built-in '" + Identifier.DEFAULT_NAMESPACE + "' namespace");
        }
    }

    /**
     * Strict defaults: no naked names, no nesting, citation clearing on.
     */
    public static ParserConfig defaults() {
        return builder().build();
    }

    /**
     * Lenient parsing: naked names and nested statements allowed.
     */
    public static ParserConfig lenient() {
        return builder().allowNakedNames(true).allowNested(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean allowNakedNames = false;
        private boolean allowNested = false;
        private boolean citationClearing = true;
        private boolean inferImplicitEdges = false;
        private String nakedNamespace = DEFAULT_NAKED_NAMESPACE;
        private int maxTermDepth = DEFAULT_MAX_TERM_DEPTH;

        public Builder allowNakedNames(boolean allowNakedNames) {
            this.allowNakedNames = allowNakedNames;
            return this;
        }

        public Builder allowNested(boolean allowNested) {
            this.allowNested = allowNested;
            return this;
        }

        public Builder citationClearing(boolean citationClearing) {
            this.citationClearing = citationClearing;
            return this;
        }

        public Builder inferImplicitEdges(boolean inferImplicitEdges) {
            this.inferImplicitEdges = inferImplicitEdges;
            return this;
        }

        public Builder nakedNamespace(String nakedNamespace) {
            this.nakedNamespace = nakedNamespace;
            return this;
        }

        public Builder maxTermDepth(int maxTermDepth) {
            this.maxTermDepth = maxTermDepth;
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(allowNakedNames, allowNested, citationClearing,
                    inferImplicitEdges, nakedNamespace, maxTermDepth);
        }
    }
}
