package com.cern.ast;

import java.util.List;

public record Program(List<NodeRef<Stmt>> stmts) implements Node {
    public Program {
        stmts = List.copyOf(stmts);
    }

    @Override
    public String type() {
        return "Program";
    }
}
