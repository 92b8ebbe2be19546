package com.cern;

/**
 * A lexical token.
 *
 * @param type  the token kind
 * @param value literal text for identifiers and literals, null otherwise
 * @param line  1-based source line
 */
public record Token(TokenType type, String value, int line) {

    public Token(TokenType type, int line) {
        this(type, null, line);
    }

    @Override
    public String toString() {
        return value != null ? type + "(" + value + ")@" + line : type + "@" + line;
    }
}
