package com.bel.graph.core.model;

import java.util.Objects;

/**
 * A non-fatal problem found while parsing.
 *
 * @param lineNumber 1-based line (or record) number, 0 when not tied to a line
 * @param line       the offending source text
 * @param kind       what went wrong
 * @param message    human-readable detail
 */
public record ParseWarning(long lineNumber, String line, WarningKind kind, String message) {

    public ParseWarning {
        Objects.requireNonNull(kind, "kind is required");
        line = line != null ? line : "";
        message = message != null ? message : kind.name();
    }

    public ErrorCategory category() {
        return kind.getCategory();
    }

    /**
     * Returns a copy positioned at the given line.
     */
    public ParseWarning at(long lineNumber, String line) {
        return new ParseWarning(lineNumber, line, kind, message);
    }

    @Override
    public String toString() {
        return "line " + lineNumber + " [" + kind + "] " + message;
    }
}
