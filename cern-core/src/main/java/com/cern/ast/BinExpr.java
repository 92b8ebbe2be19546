package com.cern.ast;

import com.cern.TokenType;

/**
 * Arithmetic binary expression, one record per operator.
 */
public sealed interface BinExpr extends ExprValue permits Add, Sub, Mul, Div {
    NodeRef<Expr> lhs();

    NodeRef<Expr> rhs();

    TokenType operator();

    static BinExpr of(TokenType operator, NodeRef<Expr> lhs, NodeRef<Expr> rhs) {
        return switch (operator) {
            case PLUS -> new Add(lhs, rhs);
            case MINUS -> new Sub(lhs, rhs);
            case STAR -> new Mul(lhs, rhs);
            case SLASH -> new Div(lhs, rhs);
            default -> throw new IllegalArgumentException("Not a binary operator: " + operator);
        };
    }
}
