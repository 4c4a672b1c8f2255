package com.bel.graph.core.model;

/**
 * Top-level classification of parse problems.
 */
public enum ErrorCategory {
    /** Unparsable token or line structure. */
    LEXICAL,
    /** Well-formed input that is not valid against vocabularies or context rules. */
    SEMANTIC,
    /** Malformed nesting, unknown keywords or wrong argument counts. */
    STRUCTURAL
}
