package com.cern.ast;

/**
 * Smallest expression unit.
 */
public sealed interface Term extends ExprValue permits IntegerLiteral, CharLiteral, Identifier, ParenExpr {
    VarType varType();
}
