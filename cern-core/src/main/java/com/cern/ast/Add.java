package com.cern.ast;

import com.cern.TokenType;

public record Add(NodeRef<Expr> lhs, NodeRef<Expr> rhs) implements BinExpr {
    @Override
    public TokenType operator() {
        return TokenType.PLUS;
    }

    @Override
    public String type() {
        return "Add";
    }
}
