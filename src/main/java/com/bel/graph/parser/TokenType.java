package com.bel.graph.parser;

/**
 * Lexical categories of BEL text.
 */
public enum TokenType {
    WORD,
    STRING,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    EQUALS,
    RELATION_SYMBOL,
    EOF
}
