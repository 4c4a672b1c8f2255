package com.bel.graph.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one logical BEL line into tokens.
 *
 * <p>Bare words consist of letters, digits, {@code _} and {@code .}, with single hyphens
 * allowed between them ({@code HLA-A}); anything else must be quoted. Relation symbols
 * ({@code ->}, {@code -|}, {@code =>}, {@code =|}, {@code --}, {@code :>}, {@code >>})
 * are recognized as single tokens.</p>
 */
public final class BelLexer {

    private BelLexer() {
        // utility class
    }

    public static List<Token> tokenize(String text) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();

        while (i < length) {
            char c = text.charAt(i);
            int column = i + 1;

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            char next = i + 1 < length ? text.charAt(i + 1) : '\0';
            switch (c) {
                case '"' -> {
                    StringBuilder sb = new StringBuilder();
                    int j = i + 1;
                    boolean closed = false;
                    while (j < length) {
                        char s = text.charAt(j);
                        if (s == '\\' && j + 1 < length
                                && (text.charAt(j + 1) == '"' || text.charAt(j + 1) == '\\')) {
                            sb.append(text.charAt(j + 1));
                            j += 2;
                        } else if (s == '"') {
                            closed = true;
                            j++;
                            break;
                        } else {
                            sb.append(s);
                            j++;
                        }
                    }
                    if (!closed) {
                        throw new LexicalException("unterminated string starting at column " + column);
                    }
                    tokens.add(new Token(TokenType.STRING, sb.toString(), column));
                    i = j;
                }
                case '(' -> {
                    tokens.add(new Token(TokenType.LPAREN, "(", column));
                    i++;
                }
                case ')' -> {
                    tokens.add(new Token(TokenType.RPAREN, ")", column));
                    i++;
                }
                case '{' -> {
                    tokens.add(new Token(TokenType.LBRACE, "{", column));
                    i++;
                }
                case '}' -> {
                    tokens.add(new Token(TokenType.RBRACE, "}", column));
                    i++;
                }
                case ',' -> {
                    tokens.add(new Token(TokenType.COMMA, ",", column));
                    i++;
                }
                case ':' -> {
                    if (next == '>') {
                        tokens.add(new Token(TokenType.RELATION_SYMBOL, ":>", column));
                        i += 2;
                    } else {
                        tokens.add(new Token(TokenType.COLON, ":", column));
                        i++;
                    }
                }
                case '=' -> {
                    if (next == '>' || next == '|') {
                        tokens.add(new Token(TokenType.RELATION_SYMBOL, "=" + next, column));
                        i += 2;
                    } else {
                        tokens.add(new Token(TokenType.EQUALS, "=", column));
                        i++;
                    }
                }
                case '-' -> {
                    if (next == '>' || next == '|' || next == '-') {
                        tokens.add(new Token(TokenType.RELATION_SYMBOL, "-" + next, column));
                        i += 2;
                    } else {
                        throw new LexicalException("unexpected '-' at column " + column);
                    }
                }
                case '>' -> {
                    if (next == '>') {
                        tokens.add(new Token(TokenType.RELATION_SYMBOL, ">>", column));
                        i += 2;
                    } else {
                        throw new LexicalException("unexpected '>' at column " + column);
                    }
                }
                default -> {
                    if (!isWordChar(c)) {
                        throw new LexicalException("unexpected character '" + c + "' at column " + column);
                    }
                    int j = i + 1;
                    while (j < length) {
                        char w = text.charAt(j);
                        if (isWordChar(w)) {
                            j++;
                        } else if (w == '-' && j + 1 < length && isWordChar(text.charAt(j + 1))) {
                            j += 2;
                        } else {
                            break;
                        }
                    }
                    tokens.add(new Token(TokenType.WORD, text.substring(i, j), column));
                    i = j;
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", length + 1));
        return tokens;
    }

    static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '.';
    }
}
