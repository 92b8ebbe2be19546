package com.cern.jackson;

import com.cern.Token;
import com.cern.TokenType;
import com.cern.ast.*;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree written by {@link SyntaxTreeSerializer}. Children are read
 * before their parent, so nodes land in the new arena bottom-up just as the
 * parser would have allocated them.
 */
public class SyntaxTreeDeserializer extends StdDeserializer<SyntaxTree> {

    public SyntaxTreeDeserializer() {
        super(SyntaxTree.class);
    }

    @Override
    public SyntaxTree deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = ctxt.readTree(p);
        return new TreeReader(ctxt).readProgram(root);
    }

    private static final class TreeReader {
        private final DeserializationContext ctxt;
        private final NodeArena arena = new NodeArena();

        TreeReader(DeserializationContext ctxt) {
            this.ctxt = ctxt;
        }

        SyntaxTree readProgram(JsonNode node) throws IOException {
            String type = typeOf(node);
            if (!type.equals("Program")) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Expected a Program node but found '%s'", type);
            }
            NodeRef<Program> root = arena.construct(new Program(readBody(node)));
            return new SyntaxTree(arena, root);
        }

        private List<NodeRef<Stmt>> readBody(JsonNode node) throws IOException {
            JsonNode body = field(node, "body");
            if (!body.isArray()) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "'body' of a %s node must be an array", typeOf(node));
            }
            List<NodeRef<Stmt>> stmts = new ArrayList<>();
            for (JsonNode stmt : body) {
                stmts.add(readStmt(stmt));
            }
            return stmts;
        }

        private NodeRef<Stmt> readStmt(JsonNode node) throws IOException {
            String type = typeOf(node);
            return switch (type) {
                case "Return" -> arena.construct(new ReturnStmt(readExpr(field(node, "expr"))));
                case "VarDecl" -> {
                    Token identifier = readToken(field(node, "identifier"));
                    yield arena.construct(new VarDeclStmt(identifier, readExpr(field(node, "expr"))));
                }
                case "VarAssign" -> {
                    Token identifier = readToken(field(node, "identifier"));
                    yield arena.construct(new VarAssignStmt(identifier, readExpr(field(node, "expr"))));
                }
                case "Scope" -> NodeRef.widen(readScope(node));
                case "If" -> {
                    NodeRef<Expr> condition = readExpr(field(node, "condition"));
                    NodeRef<Scope> scope = readScope(field(node, "scope"));
                    NodeRef<IfPred> pred = readOptionalPred(node);
                    yield arena.construct(new IfStmt(condition, scope, pred));
                }
                default -> ctxt.reportInputMismatch(SyntaxTree.class, "Unknown statement type '%s'", type);
            };
        }

        private NodeRef<Scope> readScope(JsonNode node) throws IOException {
            String type = typeOf(node);
            if (!type.equals("Scope")) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Expected a Scope node but found '%s'", type);
            }
            return arena.construct(new Scope(readBody(node)));
        }

        private NodeRef<IfPred> readOptionalPred(JsonNode owner) throws IOException {
            JsonNode pred = owner.get("pred");
            if (pred == null || pred.isNull()) {
                return null;
            }
            String type = typeOf(pred);
            return switch (type) {
                case "Elif" -> {
                    NodeRef<Expr> condition = readExpr(field(pred, "condition"));
                    NodeRef<Scope> scope = readScope(field(pred, "scope"));
                    NodeRef<IfPred> next = readOptionalPred(pred);
                    yield arena.construct(new ElifPred(condition, scope, next));
                }
                case "Else" -> arena.construct(new ElsePred(readScope(field(pred, "scope"))));
                default -> ctxt.reportInputMismatch(SyntaxTree.class, "Unknown predicate type '%s'", type);
            };
        }

        private NodeRef<Expr> readExpr(JsonNode node) throws IOException {
            String type = typeOf(node);
            if (!type.equals("Expr")) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Expected an Expr node but found '%s'", type);
            }
            NodeRef<ExprValue> value = readExprValue(field(node, "value"));
            return arena.construct(new Expr(value, readVarType(node)));
        }

        private NodeRef<ExprValue> readExprValue(JsonNode node) throws IOException {
            String type = typeOf(node);
            return switch (type) {
                case "IntegerLiteral" -> arena.construct(new IntegerLiteral(readToken(field(node, "token"))));
                case "CharLiteral" -> arena.construct(new CharLiteral(readToken(field(node, "token"))));
                case "Identifier" -> arena.construct(new Identifier(readToken(field(node, "token")), readVarType(node)));
                case "Paren" -> arena.construct(new ParenExpr(readExpr(field(node, "expr")), readVarType(node)));
                case "Add", "Sub", "Mul", "Div" -> {
                    NodeRef<Expr> lhs = readExpr(field(node, "lhs"));
                    NodeRef<Expr> rhs = readExpr(field(node, "rhs"));
                    yield arena.construct(BinExpr.of(operatorFor(type), lhs, rhs));
                }
                default -> ctxt.reportInputMismatch(SyntaxTree.class, "Unknown expression type '%s'", type);
            };
        }

        private static TokenType operatorFor(String type) {
            return switch (type) {
                case "Add" -> TokenType.PLUS;
                case "Sub" -> TokenType.MINUS;
                case "Mul" -> TokenType.STAR;
                default -> TokenType.SLASH;
            };
        }

        private Token readToken(JsonNode node) throws IOException {
            String kind = field(node, "kind").asText();
            TokenType type;
            try {
                type = TokenType.valueOf(kind);
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Unknown token kind '%s'", kind);
            }
            JsonNode value = node.get("value");
            return new Token(type, value == null || value.isNull() ? null : value.asText(), node.path("line").asInt(0));
        }

        private VarType readVarType(JsonNode node) throws IOException {
            String name = field(node, "varType").asText();
            try {
                return VarType.valueOf(name);
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Unknown varType '%s'", name);
            }
        }

        private String typeOf(JsonNode node) throws IOException {
            JsonNode type = node.get("type");
            if (!node.isObject() || type == null || !type.isTextual()) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Node without a 'type' property: %s", node);
            }
            return type.asText();
        }

        private JsonNode field(JsonNode node, String name) throws IOException {
            JsonNode child = node.get(name);
            if (child == null || child.isNull()) {
                return ctxt.reportInputMismatch(SyntaxTree.class, "Missing '%s' in %s node", name, typeOf(node));
            }
            return child;
        }
    }
}
