package com.cern.ast;

import com.cern.Token;

/**
 * {@code name = expr}, reassignment of an existing variable.
 */
public record VarAssignStmt(Token identifier, NodeRef<Expr> expr) implements Stmt {
    public String name() {
        return identifier.value();
    }

    @Override
    public String type() {
        return "VarAssign";
    }
}
