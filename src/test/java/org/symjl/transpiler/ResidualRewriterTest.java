package org.symjl.transpiler;

import org.junit.jupiter.api.*;
import org.symjl.expr.BinaryOperation;
import org.symjl.expr.BinaryOperator;
import org.symjl.expr.ExpressionArena;
import org.symjl.expr.ExpressionNode;
import org.symjl.expr.StateBuffer;
import org.symjl.expr.StateVectorReference;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for turning a semi-explicit right-hand side into a DAE residual.
 */
@DisplayName("Residual Rewriter Tests")
class ResidualRewriterTest {

    private ExpressionArena arena;
    private ResidualRewriter rewriter;

    @BeforeEach
    void setUp() {
        arena = new ExpressionArena();
        rewriter = new ResidualRewriter(arena);
    }

    @Test
    @DisplayName("Differential children subtract the matching derivative; algebraic ones are kept")
    void testSplitByDifferentialCount() {
        // GIVEN: [a; b] with a of size 1 and b of size 2
        ExpressionNode a = arena.multiply(arena.scalar(2.0), arena.stateVector(0, 1));
        ExpressionNode b = arena.stateVector(1, 3);
        ExpressionNode root = arena.concatenate(a, b);

        // WHEN: Only the first equation is differential
        ExpressionNode rewritten = rewriter.rewrite(root, 1);

        // THEN: a becomes a - dy[0:1] and b is untouched
        assertEquals(2, rewritten.children().size());
        BinaryOperation residual = (BinaryOperation) rewritten.children().get(0);
        assertEquals(BinaryOperator.SUBTRACT, residual.operator());
        assertSame(a, residual.left());
        StateVectorReference derivative = (StateVectorReference) residual.right();
        assertEquals(StateBuffer.DERIVATIVE, derivative.buffer());
        assertEquals(range(0, 1), derivative.selection());
        assertSame(b, rewritten.children().get(1));
    }

    @Test
    @DisplayName("A child straddling the differential count is algebraic")
    void testStraddlingChild() {
        ExpressionNode root = arena.concatenate(arena.stateVector(0, 2), arena.stateVector(2, 4));

        ExpressionNode rewritten = rewriter.rewrite(root, 3);

        BinaryOperation first = (BinaryOperation) rewritten.children().get(0);
        assertEquals(range(0, 2), ((StateVectorReference) first.right()).selection());
        assertSame(arena.stateVector(2, 4), rewritten.children().get(1));
    }

    @Test
    @DisplayName("Every child is differential when the count covers the whole root")
    void testAllDifferential() {
        ExpressionNode root = arena.concatenate(arena.time(), arena.stateVector(0, 2));

        ExpressionNode rewritten = rewriter.rewrite(root, 3);

        BinaryOperation second = (BinaryOperation) rewritten.children().get(1);
        assertEquals(range(1, 3), ((StateVectorReference) second.right()).selection());
    }

    @Test
    @DisplayName("A root that is not a concatenation is treated as its only child")
    void testSingleRoot() {
        ExpressionNode y = arena.stateVector(0, 2);

        ExpressionNode rewritten = rewriter.rewrite(y, 2);

        assertEquals(arena.subtract(y, arena.stateVectorDot(0, 2)), rewritten);
        assertSame(y, rewriter.rewrite(y, 0));
    }

    @Test
    @DisplayName("Rewriting is deterministic through interning")
    void testInterned() {
        ExpressionNode root = arena.concatenate(arena.stateVector(0, 1), arena.stateVector(1, 2));

        assertSame(rewriter.rewrite(root, 1), rewriter.rewrite(root, 1));
        assertThrows(IllegalArgumentException.class, () -> rewriter.rewrite(root, -1));
    }

    private static BitSet range(int start, int stop) {
        BitSet bits = new BitSet();
        bits.set(start, stop);
        return bits;
    }
}
