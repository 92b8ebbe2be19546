package com.cern;

import com.cern.ast.*;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Recursive-descent parser for statements with precedence climbing for
 * arithmetic expressions. Operand types are checked while expressions are
 * folded.
 *
 * <p>Every parse method returns {@code null} when its construct is simply not
 * present at the cursor. Anything required but missing after that point is
 * fatal and raises a {@link ParseException}; there is no recovery.</p>
 *
 * <p>A parser instance is single-use and single-threaded.</p>
 */
public class Parser {
    private static final Logger logger = Logging.getCernLogger();

    // Lowest binding power, used for a full expression
    private static final int PREC_NONE = 0;

    private final List<Token> tokens;
    private final NodeArena arena;
    private int current = 0;
    private boolean parsed = false;

    public Parser(List<Token> tokens) {
        this(tokens, NodeArena.DEFAULT_CAPACITY);
    }

    public Parser(List<Token> tokens, int arenaCapacity) {
        this.tokens = List.copyOf(tokens);
        this.arena = new NodeArena(arenaCapacity);
    }

    /**
     * Parses statements until the tokens run out. An empty stream is a valid,
     * empty program; leftover tokens that start no statement are fatal.
     */
    public SyntaxTree parseProgram() {
        if (parsed) {
            throw new IllegalStateException("Parser instances are single-use");
        }
        parsed = true;

        List<NodeRef<Stmt>> stmts = new ArrayList<>();
        while (peek() != null) {
            NodeRef<Stmt> stmt = parseStatement();
            if (stmt == null) {
                throw missing("statement");
            }
            stmts.add(stmt);
        }

        NodeRef<Program> root = arena.construct(new Program(stmts));
        if (logger.isDebugEnabled()) {
            logger.debug("Parsed " + stmts.size() + " top-level statements into " + arena.size() + " nodes");
        }
        return new SyntaxTree(arena, root);
    }

    /**
     * Statement dispatch, first match wins:
     * return, var declaration, reassignment, scope, if.
     */
    public NodeRef<Stmt> parseStatement() {
        if (peek() == null) {
            return null;
        }

        if (check(TokenType.RETURN)) {
            advance();
            NodeRef<Expr> expr = parseExpr();
            if (expr == null) {
                throw missing(TokenType.RETURN.displayName());
            }
            return arena.construct(new ReturnStmt(expr));
        }

        if (check(TokenType.VAR) && checkAhead(1, TokenType.IDENTIFIER) && checkAhead(2, TokenType.EQUAL)) {
            advance(); // var
            Token identifier = advance();
            advance(); // =
            return arena.construct(new VarDeclStmt(identifier, requireExpr()));
        }

        if (check(TokenType.IDENTIFIER) && checkAhead(1, TokenType.EQUAL)) {
            Token identifier = advance();
            advance(); // =
            return arena.construct(new VarAssignStmt(identifier, requireExpr()));
        }

        if (check(TokenType.LEFT_CURLY_BRACKET)) {
            return NodeRef.widen(requireScope());
        }

        if (tryConsume(TokenType.IF) != null) {
            expect(TokenType.LEFT_PARENTHESIS);
            NodeRef<Expr> condition = requireExpr();
            expect(TokenType.RIGHT_PARENTHESIS);
            NodeRef<Scope> scope = requireScope();
            NodeRef<IfPred> pred = parseIfPredicate();
            return arena.construct(new IfStmt(condition, scope, pred));
        }

        return null;
    }

    /**
     * {@code { stmt* }}. Returns null if the cursor is not on an opening brace.
     */
    public NodeRef<Scope> parseScope() {
        if (tryConsume(TokenType.LEFT_CURLY_BRACKET) == null) {
            return null;
        }

        List<NodeRef<Stmt>> stmts = new ArrayList<>();
        NodeRef<Stmt> stmt;
        while ((stmt = parseStatement()) != null) {
            stmts.add(stmt);
        }

        expect(TokenType.RIGHT_CURLY_BRACKET);
        return arena.construct(new Scope(stmts));
    }

    /**
     * Trailing {@code elif (e) {..}} links, optionally closed by {@code else {..}}.
     * Returns null for a plain if.
     */
    public NodeRef<IfPred> parseIfPredicate() {
        if (tryConsume(TokenType.ELIF) != null) {
            expect(TokenType.LEFT_PARENTHESIS);
            NodeRef<Expr> condition = requireExpr();
            expect(TokenType.RIGHT_PARENTHESIS);
            NodeRef<Scope> scope = requireScope();
            NodeRef<IfPred> next = parseIfPredicate();
            return arena.construct(new ElifPred(condition, scope, next));
        }

        if (tryConsume(TokenType.ELSE) != null) {
            return arena.construct(new ElsePred(requireScope()));
        }

        return null;
    }

    public NodeRef<Expr> parseExpr() {
        return parseExpr(PREC_NONE);
    }

    /**
     * Precedence climbing. Folds every operator whose precedence is at least
     * {@code minPrecedence}; the right operand is parsed one level tighter,
     * which makes all operators left-associative.
     */
    public NodeRef<Expr> parseExpr(int minPrecedence) {
        NodeRef<Term> term = parseTerm();
        if (term == null) {
            return null;
        }

        NodeRef<Expr> expr = arena.construct(new Expr(term, arena.get(term).varType()));

        while (true) {
            Token op = peek();
            if (op == null) {
                break;
            }
            OptionalInt precedence = op.type().binaryPrecedence();
            if (precedence.isEmpty() || precedence.getAsInt() < minPrecedence) {
                break;
            }
            advance();

            NodeRef<Expr> rhs = parseExpr(precedence.getAsInt() + 1);
            if (rhs == null) {
                throw missing("expression");
            }

            Expr lhs = arena.get(expr);
            VarType resultType = checkOperandTypes(lhs.varType(), op, arena.get(rhs).varType());

            // The running left operand moves to a fresh slot and its old slot
            // becomes the fold, so `expr` keeps naming the whole chain.
            NodeRef<Expr> movedLhs = arena.construct(lhs);
            NodeRef<BinExpr> bin = arena.construct(BinExpr.of(op.type(), movedLhs, rhs));
            arena.rewrite(expr, new Expr(bin, resultType));

            if (logger.isTraceEnabled()) {
                logger.trace("Folded '" + op.type().displayName() + "' on line " + op.line() + " as " + resultType.displayName());
            }
        }

        return expr;
    }

    /**
     * Integer literal, char literal, identifier or parenthesized expression.
     * Returns null if none of them starts at the cursor.
     */
    public NodeRef<Term> parseTerm() {
        Token intLit = tryConsume(TokenType.INTEGER_LITERAL);
        if (intLit != null) {
            return arena.construct(new IntegerLiteral(intLit));
        }

        Token charLit = tryConsume(TokenType.CHAR_LITERAL);
        if (charLit != null) {
            return arena.construct(new CharLiteral(charLit));
        }

        Token ident = tryConsume(TokenType.IDENTIFIER);
        if (ident != null) {
            return arena.construct(new Identifier(ident));
        }

        if (tryConsume(TokenType.LEFT_PARENTHESIS) != null) {
            NodeRef<Expr> inner = requireExpr();
            expect(TokenType.RIGHT_PARENTHESIS);
            return arena.construct(new ParenExpr(inner, arena.get(inner).varType()));
        }

        return null;
    }

    public NodeArena getArena() {
        return arena;
    }

    // Unresolved operands get no verdict; the result takes whichever type is known
    private static VarType checkOperandTypes(VarType left, Token op, VarType right) {
        if (left.isResolved() && right.isResolved() && left != right) {
            throw new TypeMismatchException(left, op.type(), right, op.line());
        }
        return left.isResolved() ? left : right;
    }

    private NodeRef<Expr> requireExpr() {
        NodeRef<Expr> expr = parseExpr();
        if (expr == null) {
            throw missing("expression");
        }
        return expr;
    }

    private NodeRef<Scope> requireScope() {
        NodeRef<Scope> scope = parseScope();
        if (scope == null) {
            throw missing("scope");
        }
        return scope;
    }

    // Token stream helpers

    /**
     * Token at cursor + offset, or null when out of range.
     */
    Token peek(int offset) {
        int pos = current + offset;
        if (pos < 0 || pos >= tokens.size()) {
            return null;
        }
        return tokens.get(pos);
    }

    Token peek() {
        return peek(0);
    }

    private boolean check(TokenType type) {
        return checkAhead(0, type);
    }

    private boolean checkAhead(int offset, TokenType type) {
        Token token = peek(offset);
        return token != null && token.type() == type;
    }

    /**
     * Returns the current token and moves past it. Callers check {@link #peek()} first.
     */
    private Token advance() {
        return tokens.get(current++);
    }

    /**
     * Consumes a token of the given kind or returns null without moving.
     */
    Token tryConsume(TokenType type) {
        if (check(type)) {
            return advance();
        }
        return null;
    }

    /**
     * Consumes a token of the given kind or fails the parse.
     */
    Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(type, errorLine());
    }

    private ParseException missing(String construct) {
        return ParseException.missing(construct, errorLine());
    }

    // Line of the current token, or of the last one once the stream is exhausted
    private int errorLine() {
        Token token = peek();
        if (token == null) {
            token = peek(-1);
        }
        return token != null ? token.line() : 0;
    }

    public static SyntaxTree parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseProgram();
    }
}
