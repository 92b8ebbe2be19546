package com.cern.ast;

public sealed interface Stmt extends Node permits ReturnStmt, VarDeclStmt, VarAssignStmt, Scope, IfStmt {
}
