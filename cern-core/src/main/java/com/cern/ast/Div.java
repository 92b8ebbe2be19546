package com.cern.ast;

import com.cern.TokenType;

public record Div(NodeRef<Expr> lhs, NodeRef<Expr> rhs) implements BinExpr {
    @Override
    public TokenType operator() {
        return TokenType.SLASH;
    }

    @Override
    public String type() {
        return "Div";
    }
}
