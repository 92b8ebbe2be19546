package com.cern.ast;

/**
 * Base interface for all syntax tree nodes. Nodes are immutable and live in a
 * {@link NodeArena}; composite nodes refer to their children through
 * {@link NodeRef} handles into that arena.
 */
public sealed interface Node permits
    Program,
    Stmt,
    IfPred,
    Expr,
    ExprValue {

    /**
     * Node kind tag, e.g. "Add" or "VarDecl".
     */
    String type();
}
