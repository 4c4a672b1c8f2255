package com.bel.graph.parser;

import com.bel.graph.core.model.WarningKind;

/**
 * Unparsable token or line structure.
 */
public class LexicalException extends BelParseException {

    public LexicalException(String message) {
        super(WarningKind.INVALID_TOKEN, message);
    }

    public LexicalException(WarningKind kind, String message) {
        super(kind, message);
    }
}
