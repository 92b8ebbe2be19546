package com.cern.ast;

import com.cern.Token;

public record CharLiteral(Token token) implements Term {
    public String value() {
        return token.value();
    }

    @Override
    public VarType varType() {
        return VarType.CHAR;
    }

    @Override
    public String type() {
        return "CharLiteral";
    }
}
