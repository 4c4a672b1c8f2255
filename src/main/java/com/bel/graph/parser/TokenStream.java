package com.bel.graph.parser;

import com.bel.graph.core.model.WarningKind;

import java.util.List;

/**
 * Cursor over the tokens of one line.
 */
public class TokenStream {

    private final List<Token> tokens;
    private int position;

    public TokenStream(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    public static TokenStream of(String text) throws LexicalException {
        return new TokenStream(BelLexer.tokenize(text));
    }

    public Token peek() {
        return tokens.get(position);
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(position + ahead, tokens.size() - 1));
    }

    public Token next() {
        Token token = tokens.get(position);
        if (!token.is(TokenType.EOF)) {
            position++;
        }
        return token;
    }

    /**
     * Consumes the next token if it has the given type.
     */
    public boolean accept(TokenType type) {
        if (peek().is(type)) {
            next();
            return true;
        }
        return false;
    }

    /**
     * Consumes the next token, which must have the given type.
     */
    public Token expect(TokenType type, String what) throws StructuralException {
        Token token = peek();
        if (!token.is(type)) {
            throw new StructuralException(WarningKind.MALFORMED_TERM,
                    "expected " + what + " at column " + token.column() + " but found " + token.describe());
        }
        return next();
    }

    public boolean atEnd() {
        return peek().is(TokenType.EOF);
    }

    public int position() {
        return position;
    }
}
