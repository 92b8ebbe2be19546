package com.cern.ast;

import java.util.List;

/**
 * Renders nodes as S-expressions, e.g. {@code (add (ident a) (mul (ident b) (int 2)))}.
 */
public final class TreePrinter {
    private final NodeArena arena;

    public TreePrinter(NodeArena arena) {
        this.arena = arena;
    }

    public static String print(SyntaxTree tree) {
        return new TreePrinter(tree.arena()).print(tree.root());
    }

    public String print(NodeRef<? extends Node> ref) {
        StringBuilder sb = new StringBuilder();
        append(sb, ref);
        return sb.toString();
    }

    private void append(StringBuilder sb, NodeRef<? extends Node> ref) {
        Node node = arena.get(ref);

        if (node instanceof Program program) {
            sb.append("(program");
            appendAll(sb, program.stmts());
            sb.append(')');
        } else if (node instanceof Expr expr) {
            append(sb, expr.value());
        } else if (node instanceof IntegerLiteral lit) {
            sb.append("(int ").append(lit.value()).append(')');
        } else if (node instanceof CharLiteral lit) {
            sb.append("(char ").append(lit.value()).append(')');
        } else if (node instanceof Identifier ident) {
            sb.append("(ident ").append(ident.name()).append(')');
        } else if (node instanceof ParenExpr paren) {
            sb.append("(paren ");
            append(sb, paren.expr());
            sb.append(')');
        } else if (node instanceof BinExpr bin) {
            sb.append('(').append(bin.type().toLowerCase()).append(' ');
            append(sb, bin.lhs());
            sb.append(' ');
            append(sb, bin.rhs());
            sb.append(')');
        } else if (node instanceof ReturnStmt ret) {
            sb.append("(return ");
            append(sb, ret.expr());
            sb.append(')');
        } else if (node instanceof VarDeclStmt decl) {
            sb.append("(var ").append(decl.name()).append(' ');
            append(sb, decl.expr());
            sb.append(')');
        } else if (node instanceof VarAssignStmt assign) {
            sb.append("(assign ").append(assign.name()).append(' ');
            append(sb, assign.expr());
            sb.append(')');
        } else if (node instanceof Scope scope) {
            sb.append("(scope");
            appendAll(sb, scope.stmts());
            sb.append(')');
        } else if (node instanceof IfStmt stmt) {
            sb.append("(if ");
            append(sb, stmt.condition());
            sb.append(' ');
            append(sb, stmt.scope());
            appendPred(sb, stmt.pred());
            sb.append(')');
        } else if (node instanceof ElifPred elif) {
            sb.append("(elif ");
            append(sb, elif.condition());
            sb.append(' ');
            append(sb, elif.scope());
            appendPred(sb, elif.pred());
            sb.append(')');
        } else if (node instanceof ElsePred elsePred) {
            sb.append("(else ");
            append(sb, elsePred.scope());
            sb.append(')');
        } else {
            throw new IllegalStateException("Unknown node kind: " + node.type());
        }
    }

    private void appendAll(StringBuilder sb, List<NodeRef<Stmt>> stmts) {
        for (NodeRef<Stmt> stmt : stmts) {
            sb.append(' ');
            append(sb, stmt);
        }
    }

    private void appendPred(StringBuilder sb, NodeRef<IfPred> pred) {
        if (pred != null) {
            sb.append(' ');
            append(sb, pred);
        }
    }
}
