package com.cern.ast;

import com.cern.TokenType;

/**
 * Inferred type of an expression. NONE means the type could not be
 * determined while parsing (bare identifiers).
 */
public enum VarType {
    NONE("none"),
    INT("int"),
    CHAR("char");

    private final String displayName;

    VarType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isResolved() {
        return this != NONE;
    }

    public static VarType of(TokenType tokenType) {
        return switch (tokenType) {
            case INTEGER_LITERAL -> INT;
            case CHAR_LITERAL -> CHAR;
            default -> NONE;
        };
    }
}
