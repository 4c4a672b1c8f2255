package com.bel.graph.parser;

import com.bel.graph.core.model.WarningKind;

/**
 * Well-formed input rejected by a vocabulary or context rule, e.g. a naked name under
 * strict parsing or a qualified statement without citation and evidence.
 */
public class SemanticException extends BelParseException {

    public SemanticException(WarningKind kind, String message) {
        super(kind, message);
    }
}
