package com.cern.ast;

/**
 * What an {@link Expr} wraps: a term or a binary expression.
 */
public sealed interface ExprValue extends Node permits Term, BinExpr {
}
