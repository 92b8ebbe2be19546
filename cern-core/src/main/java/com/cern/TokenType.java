package com.cern;

import java.util.OptionalInt;

public enum TokenType {
    // Keywords
    RETURN("return value"),
    VAR("var"),
    FUNC("func"),
    IF("if"),
    ELIF("elif"),
    ELSE("else"),

    // Type keywords
    TYPE_INT("int"),
    TYPE_CHAR("char"),

    // Names and literals
    IDENTIFIER("identifier"),
    INTEGER_LITERAL("integer literal"),
    CHAR_LITERAL("char literal"),

    // Punctuation
    EQUAL("="),
    COLON(":"),
    COMMA(","),
    LEFT_PARENTHESIS("("),
    RIGHT_PARENTHESIS(")"),
    LEFT_CURLY_BRACKET("{"),
    RIGHT_CURLY_BRACKET("}"),

    // Arithmetic operators
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name used in diagnostics, e.g. {@code ")"} or {@code "identifier"}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Binding power of this token as a binary operator. Higher binds tighter.
     * Empty when the token is not a binary operator.
     */
    public OptionalInt binaryPrecedence() {
        return switch (this) {
            case PLUS, MINUS -> OptionalInt.of(0);
            case STAR, SLASH -> OptionalInt.of(1);
            default -> OptionalInt.empty();
        };
    }
}
