package com.cern.ast;

import com.cern.Parser;
import com.cern.Token;
import com.cern.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeArenaTest {

    private static IntegerLiteral literal(String value) {
        return new IntegerLiteral(new Token(TokenType.INTEGER_LITERAL, value, 1));
    }

    @Test
    void testConstructHandsOutSequentialSlots() {
        NodeArena arena = new NodeArena();
        NodeRef<Term> first = arena.construct(literal("1"));
        NodeRef<Term> second = arena.construct(literal("2"));

        assertEquals(0, first.index());
        assertEquals(1, second.index());
        assertEquals(2, arena.size());
        assertEquals("2", ((IntegerLiteral) arena.get(second)).value());
    }

    @Test
    void testChildrenAreReferencedByIndex() {
        NodeArena arena = new NodeArena();
        NodeRef<Term> term = arena.construct(literal("5"));
        NodeRef<Expr> expr = arena.construct(new Expr(term, VarType.INT));
        NodeRef<Stmt> ret = arena.construct(new ReturnStmt(expr));

        ReturnStmt stmt = (ReturnStmt) arena.get(ret);
        assertSame(arena.get(expr), arena.get(stmt.expr()));
        assertEquals(List.of("IntegerLiteral", "Expr", "Return"),
            arena.nodes().stream().map(Node::type).toList());
    }

    @Test
    void testCapacityIsFixed() {
        NodeArena arena = new NodeArena(2);
        arena.construct(literal("1"));
        arena.construct(literal("2"));

        ArenaExhaustedException e = assertThrows(ArenaExhaustedException.class, () -> arena.construct(literal("3")));
        assertEquals(2, e.getCapacity());
        assertEquals(2, arena.size(), "A failed allocation leaves the arena untouched");
    }

    @Test
    void testRewriteKeepsHandle() {
        NodeArena arena = new NodeArena();
        NodeRef<Term> a = arena.construct(literal("1"));
        NodeRef<Term> b = arena.construct(literal("2"));
        NodeRef<Expr> running = arena.construct(new Expr(a, VarType.INT));
        NodeRef<Expr> rhs = arena.construct(new Expr(b, VarType.INT));

        NodeRef<Expr> moved = arena.construct(arena.get(running));
        NodeRef<BinExpr> add = arena.construct(new Add(moved, rhs));
        arena.rewrite(running, new Expr(add, VarType.INT));

        assertEquals(add, arena.get(running).value());
        assertEquals(a, arena.get(moved).value());
        assertEquals("(add (int 1) (int 2))", new TreePrinter(arena).print(running));
    }

    @Test
    void testDanglingReference() {
        NodeArena arena = new NodeArena();
        arena.construct(literal("1"));
        assertThrows(IllegalArgumentException.class, () -> arena.get(new NodeRef<Term>(1)));
        assertThrows(IllegalArgumentException.class, () -> new NodeRef<Term>(-1));
    }

    @Test
    void testNodesViewIsReadOnly() {
        NodeArena arena = new NodeArena();
        arena.construct(literal("1"));
        assertThrows(UnsupportedOperationException.class, () -> arena.nodes().clear());
    }

    @Test
    void testSealedArenaRejectsChanges() {
        NodeArena arena = new NodeArena();
        NodeRef<Term> term = arena.construct(literal("1"));
        NodeRef<Expr> expr = arena.construct(new Expr(term, VarType.INT));
        arena.seal();

        assertTrue(arena.isSealed());
        assertThrows(IllegalStateException.class, () -> arena.construct(literal("2")));
        assertThrows(IllegalStateException.class, () -> arena.rewrite(expr, new Expr(term, VarType.NONE)));
        assertEquals(2, arena.size());
        assertEquals(VarType.INT, arena.get(expr).varType());
    }

    @Test
    @DisplayName("A parsed tree cannot be rewritten into a cycle")
    void testParsedTreeIsFrozen() {
        SyntaxTree tree = Parser.parse("return a + b");
        NodeArena arena = tree.arena();
        NodeRef<Expr> top = ((ReturnStmt) tree.resolve(tree.program().stmts().get(0))).expr();
        int size = arena.size();

        assertTrue(arena.isSealed());
        assertThrows(IllegalStateException.class,
            () -> arena.construct(new ParenExpr(top, VarType.NONE)));
        assertThrows(IllegalStateException.class,
            () -> arena.rewrite(top, new Expr(new NodeRef<ParenExpr>(0), VarType.NONE)));
        assertEquals(size, arena.size());
        assertEquals("(program (return (add (ident a) (ident b))))", TreePrinter.print(tree));
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new NodeArena(0));
    }
}
