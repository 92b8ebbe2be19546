package com.cern.ast;

import com.cern.TokenType;

public record Sub(NodeRef<Expr> lhs, NodeRef<Expr> rhs) implements BinExpr {
    @Override
    public TokenType operator() {
        return TokenType.MINUS;
    }

    @Override
    public String type() {
        return "Sub";
    }
}
