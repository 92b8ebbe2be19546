package com.cern.ast;

public record IfStmt(
    NodeRef<Expr> condition,
    NodeRef<Scope> scope,
    NodeRef<IfPred> pred  // Can be null
) implements Stmt {
    @Override
    public String type() {
        return "If";
    }
}
