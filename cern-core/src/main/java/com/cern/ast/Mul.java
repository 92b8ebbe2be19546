package com.cern.ast;

import com.cern.TokenType;

public record Mul(NodeRef<Expr> lhs, NodeRef<Expr> rhs) implements BinExpr {
    @Override
    public TokenType operator() {
        return TokenType.STAR;
    }

    @Override
    public String type() {
        return "Mul";
    }
}
