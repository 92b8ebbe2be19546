package com.cern.ast;

import com.cern.Token;

public record IntegerLiteral(Token token) implements Term {
    public String value() {
        return token.value();
    }

    @Override
    public VarType varType() {
        return VarType.INT;
    }

    @Override
    public String type() {
        return "IntegerLiteral";
    }
}
