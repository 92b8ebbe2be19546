package com.cern.ast;

import java.util.List;

/**
 * Braced block. Statement order is execution order.
 */
public record Scope(List<NodeRef<Stmt>> stmts) implements Stmt {
    public Scope {
        stmts = List.copyOf(stmts);
    }

    @Override
    public String type() {
        return "Scope";
    }
}
