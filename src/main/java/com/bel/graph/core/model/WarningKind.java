package com.bel.graph.core.model;

/**
 * Kinds of non-fatal problems recorded while parsing a document.
 */
public enum WarningKind {
    UNPARSABLE_LINE(ErrorCategory.LEXICAL),
    INVALID_TOKEN(ErrorCategory.LEXICAL),
    UNREADABLE_INPUT(ErrorCategory.LEXICAL),

    NAKED_NAME(ErrorCategory.SEMANTIC),
    UNKNOWN_NAMESPACE_TERM(ErrorCategory.SEMANTIC),
    NAMESPACE_UNDECLARED(ErrorCategory.SEMANTIC),
    MISSING_CONTEXT(ErrorCategory.SEMANTIC),
    INVALID_CITATION(ErrorCategory.SEMANTIC),
    ILLEGAL_ANNOTATION_VALUE(ErrorCategory.SEMANTIC),
    INVALID_METADATA(ErrorCategory.SEMANTIC),

    MALFORMED_TERM(ErrorCategory.STRUCTURAL),
    UNKNOWN_FUNCTION(ErrorCategory.STRUCTURAL),
    UNKNOWN_RELATION(ErrorCategory.STRUCTURAL),
    ARITY_MISMATCH(ErrorCategory.STRUCTURAL),
    NESTED_NOT_ALLOWED(ErrorCategory.STRUCTURAL),
    MISPLACED_LINE(ErrorCategory.STRUCTURAL);

    private final ErrorCategory category;

    WarningKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
