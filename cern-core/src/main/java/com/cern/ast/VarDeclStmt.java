package com.cern.ast;

import com.cern.Token;

/**
 * {@code var name = expr}
 */
public record VarDeclStmt(Token identifier, NodeRef<Expr> expr) implements Stmt {
    public String name() {
        return identifier.value();
    }

    @Override
    public String type() {
        return "VarDecl";
    }
}
