package com.bel.graph.parser;

import com.bel.graph.core.model.WarningKind;

/**
 * Malformed term nesting, unknown function or relation keyword, or an argument-arity mismatch.
 */
public class StructuralException extends BelParseException {

    public StructuralException(WarningKind kind, String message) {
        super(kind, message);
    }
}
