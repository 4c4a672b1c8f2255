package com.bel.graph.parser;

/**
 * A lexical token. For {@link TokenType#STRING} the text is the unescaped content
 * without the surrounding quotes.
 *
 * @param type   the token category
 * @param text   the token text
 * @param column 1-based column where the token starts
 */
public record Token(TokenType type, String text, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isWord(String word) {
        return type == TokenType.WORD && text.equals(word);
    }

    /**
     * Describes the token for error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of line";
            case STRING -> "\"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
