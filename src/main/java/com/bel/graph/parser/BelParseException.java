package com.bel.graph.parser;

import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.WarningKind;

import java.util.Objects;

/**
 * Checked exception raised while parsing a single line or term. Never escapes the
 * document driver: it is converted into a {@link ParseWarning} and parsing continues.
 */
public class BelParseException extends Exception {

    private final WarningKind kind;

    public BelParseException(WarningKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public BelParseException(WarningKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public WarningKind getKind() {
        return kind;
    }

    public ParseWarning toWarning(long lineNumber, String line) {
        return new ParseWarning(lineNumber, line, kind, getMessage());
    }
}
