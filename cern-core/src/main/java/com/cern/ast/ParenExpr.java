package com.cern.ast;

public record ParenExpr(NodeRef<Expr> expr, VarType varType) implements Term {
    @Override
    public String type() {
        return "Paren";
    }
}
