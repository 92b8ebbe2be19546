package com.cern.ast;

public record ElsePred(NodeRef<Scope> scope) implements IfPred {
    @Override
    public String type() {
        return "Else";
    }
}
