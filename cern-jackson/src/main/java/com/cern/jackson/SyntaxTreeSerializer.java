package com.cern.jackson;

import com.cern.Token;
import com.cern.ast.*;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/**
 * Writes a tree as nested objects, each tagged with the node's {@code "type"}.
 * Absent predicates are omitted rather than written as null.
 */
public class SyntaxTreeSerializer extends StdSerializer<SyntaxTree> {

    public SyntaxTreeSerializer() {
        super(SyntaxTree.class);
    }

    @Override
    public void serialize(SyntaxTree tree, JsonGenerator gen, SerializerProvider provider) throws IOException {
        writeNode(tree.arena(), tree.root(), gen);
    }

    private void writeNode(NodeArena arena, NodeRef<? extends Node> ref, JsonGenerator gen) throws IOException {
        Node node = arena.get(ref);
        gen.writeStartObject();
        gen.writeStringField("type", node.type());

        if (node instanceof Program program) {
            writeBody(arena, program.stmts(), gen);
        } else if (node instanceof Scope scope) {
            writeBody(arena, scope.stmts(), gen);
        } else if (node instanceof ReturnStmt ret) {
            writeChild(arena, "expr", ret.expr(), gen);
        } else if (node instanceof VarDeclStmt decl) {
            writeToken("identifier", decl.identifier(), gen);
            writeChild(arena, "expr", decl.expr(), gen);
        } else if (node instanceof VarAssignStmt assign) {
            writeToken("identifier", assign.identifier(), gen);
            writeChild(arena, "expr", assign.expr(), gen);
        } else if (node instanceof IfStmt stmt) {
            writeChild(arena, "condition", stmt.condition(), gen);
            writeChild(arena, "scope", stmt.scope(), gen);
            writeChild(arena, "pred", stmt.pred(), gen);
        } else if (node instanceof ElifPred elif) {
            writeChild(arena, "condition", elif.condition(), gen);
            writeChild(arena, "scope", elif.scope(), gen);
            writeChild(arena, "pred", elif.pred(), gen);
        } else if (node instanceof ElsePred elsePred) {
            writeChild(arena, "scope", elsePred.scope(), gen);
        } else if (node instanceof Expr expr) {
            gen.writeStringField("varType", expr.varType().name());
            writeChild(arena, "value", expr.value(), gen);
        } else if (node instanceof BinExpr bin) {
            writeChild(arena, "lhs", bin.lhs(), gen);
            writeChild(arena, "rhs", bin.rhs(), gen);
        } else if (node instanceof IntegerLiteral lit) {
            writeToken("token", lit.token(), gen);
        } else if (node instanceof CharLiteral lit) {
            writeToken("token", lit.token(), gen);
        } else if (node instanceof Identifier ident) {
            gen.writeStringField("varType", ident.varType().name());
            writeToken("token", ident.token(), gen);
        } else if (node instanceof ParenExpr paren) {
            gen.writeStringField("varType", paren.varType().name());
            writeChild(arena, "expr", paren.expr(), gen);
        } else {
            throw new IllegalStateException("Unknown node kind: " + node.type());
        }

        gen.writeEndObject();
    }

    private void writeBody(NodeArena arena, List<NodeRef<Stmt>> stmts, JsonGenerator gen) throws IOException {
        gen.writeArrayFieldStart("body");
        for (NodeRef<Stmt> stmt : stmts) {
            writeNode(arena, stmt, gen);
        }
        gen.writeEndArray();
    }

    private void writeChild(NodeArena arena, String name, NodeRef<? extends Node> ref, JsonGenerator gen) throws IOException {
        if (ref == null) {
            return;
        }
        gen.writeFieldName(name);
        writeNode(arena, ref, gen);
    }

    private static void writeToken(String name, Token token, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart(name);
        gen.writeStringField("kind", token.type().name());
        if (token.value() != null) {
            gen.writeStringField("value", token.value());
        }
        gen.writeNumberField("line", token.line());
        gen.writeEndObject();
    }
}
