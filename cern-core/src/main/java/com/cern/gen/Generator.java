package com.cern.gen;

import com.cern.GenerationException;
import com.cern.Logging;
import com.cern.Token;
import com.cern.ast.*;
import org.apache.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Emits a C++ translation unit whose {@code main} runs the program's top-level
 * statements. Variable declarations are tracked per scope while emitting:
 * redeclaring a name in the same scope, or reading or assigning a name that no
 * enclosing scope declares, is an error. Inner scopes may shadow.
 */
public class Generator {
    private static final Logger logger = Logging.getCernLogger();
    private static final String INDENT = "    ";

    private final SyntaxTree tree;
    private final StringBuilder out = new StringBuilder();
    private final Deque<Set<String>> scopes = new ArrayDeque<>();
    private int depth = 0;

    public Generator(SyntaxTree tree) {
        this.tree = tree;
    }

    public String generateProgram() {
        out.setLength(0);
        scopes.clear();

        out.append("#include <cstdlib>\n\n");
        out.append("int main()\n{\n");
        depth = 1;
        scopes.push(new HashSet<>());
        for (NodeRef<Stmt> stmt : tree.program().stmts()) {
            generateStatement(stmt);
        }
        line("return EXIT_SUCCESS;");
        scopes.pop();
        depth = 0;
        out.append("}\n");

        logger.debug("Generated " + out.length() + " characters of C++");
        return out.toString();
    }

    private void generateStatement(NodeRef<Stmt> ref) {
        Stmt stmt = tree.resolve(ref);

        if (stmt instanceof ReturnStmt ret) {
            line("return " + generateExpr(ret.expr()) + ";");
        } else if (stmt instanceof VarDeclStmt decl) {
            String value = generateExpr(decl.expr());
            declare(decl.identifier());
            VarType varType = tree.resolve(decl.expr()).varType();
            line(cppType(varType) + " " + decl.name() + " = " + value + ";");
        } else if (stmt instanceof VarAssignStmt assign) {
            requireDeclared(assign.identifier());
            line(assign.name() + " = " + generateExpr(assign.expr()) + ";");
        } else if (stmt instanceof Scope scope) {
            generateScope(scope);
        } else if (stmt instanceof IfStmt ifStmt) {
            line("if (" + generateExpr(ifStmt.condition()) + ")");
            generateScope(tree.resolve(ifStmt.scope()));
            generatePredicate(ifStmt.pred());
        } else {
            throw new IllegalStateException("Unknown statement kind: " + stmt.type());
        }
    }

    private void generatePredicate(NodeRef<IfPred> ref) {
        while (ref != null) {
            IfPred pred = tree.resolve(ref);
            if (pred instanceof ElifPred elif) {
                line("else if (" + generateExpr(elif.condition()) + ")");
                generateScope(tree.resolve(elif.scope()));
                ref = elif.pred();
            } else if (pred instanceof ElsePred elsePred) {
                line("else");
                generateScope(tree.resolve(elsePred.scope()));
                ref = null;
            } else {
                throw new IllegalStateException("Unknown predicate kind: " + pred.type());
            }
        }
    }

    private void generateScope(Scope scope) {
        line("{");
        depth++;
        scopes.push(new HashSet<>());
        for (NodeRef<Stmt> stmt : scope.stmts()) {
            generateStatement(stmt);
        }
        scopes.pop();
        depth--;
        line("}");
    }

    private String generateExpr(NodeRef<Expr> ref) {
        ExprValue value = tree.resolve(tree.resolve(ref).value());
        return generateValue(value);
    }

    private String generateValue(ExprValue value) {
        if (value instanceof IntegerLiteral lit) {
            return lit.value();
        } else if (value instanceof CharLiteral lit) {
            return "'" + lit.value() + "'";
        } else if (value instanceof Identifier ident) {
            requireDeclared(ident.token());
            return ident.name();
        } else if (value instanceof ParenExpr paren) {
            return "(" + generateExpr(paren.expr()) + ")";
        } else if (value instanceof BinExpr bin) {
            return generateExpr(bin.lhs()) + " " + bin.operator().displayName() + " " + generateExpr(bin.rhs());
        }
        throw new IllegalStateException("Unknown expression kind: " + value.type());
    }

    private void declare(Token identifier) {
        if (!scopes.peek().add(identifier.value())) {
            throw new GenerationException("identifier `" + identifier.value() + "` already declared", identifier.line());
        }
    }

    private void requireDeclared(Token identifier) {
        for (Set<String> scope : scopes) {
            if (scope.contains(identifier.value())) {
                return;
            }
        }
        throw new GenerationException("undeclared identifier `" + identifier.value() + "`", identifier.line());
    }

    private static String cppType(VarType varType) {
        return switch (varType) {
            case INT -> "int";
            case CHAR -> "char";
            case NONE -> "auto";
        };
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
