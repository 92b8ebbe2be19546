package com.cern.ast;

/**
 * Link in the elif/else chain hanging off an {@link IfStmt}.
 */
public sealed interface IfPred extends Node permits ElifPred, ElsePred {
    NodeRef<Scope> scope();
}
