package com.cern.ast;

public record ReturnStmt(NodeRef<Expr> expr) implements Stmt {
    @Override
    public String type() {
        return "Return";
    }
}
