package com.cern.ast;

public record ElifPred(
    NodeRef<Expr> condition,
    NodeRef<Scope> scope,
    NodeRef<IfPred> pred  // Can be null
) implements IfPred {
    @Override
    public String type() {
        return "Elif";
    }
}
