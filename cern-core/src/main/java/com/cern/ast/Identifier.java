package com.cern.ast;

import com.cern.Token;

/**
 * Reference to a variable. The type comes from the token kind alone, there is
 * no symbol table at parse time.
 */
public record Identifier(Token token, VarType varType) implements Term {
    public Identifier(Token token) {
        this(token, VarType.of(token.type()));
    }

    public String name() {
        return token.value();
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
