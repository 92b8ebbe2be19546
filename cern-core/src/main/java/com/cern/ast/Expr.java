package com.cern.ast;

public record Expr(
    NodeRef<? extends ExprValue> value,
    VarType varType
) implements Node {
    @Override
    public String type() {
        return "Expr";
    }
}
