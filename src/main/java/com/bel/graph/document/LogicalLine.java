package com.bel.graph.document;

/**
 * One BEL line after continuation joining.
 *
 * @param lineNumber 1-based physical line where the logical line starts
 * @param text       the joined text
 */
public record LogicalLine(long lineNumber, String text) {

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
