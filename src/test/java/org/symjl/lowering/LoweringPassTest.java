package org.symjl.lowering;

import org.junit.jupiter.api.*;
import org.symjl.evaluate.DenseMatrixValue;
import org.symjl.evaluate.ScalarValue;
import org.symjl.evaluate.TreeConstantEvaluator;
import org.symjl.expr.BinaryOperator;
import org.symjl.expr.DomainSlice;
import org.symjl.expr.ExpressionArena;
import org.symjl.expr.ExpressionNode;
import org.symjl.expr.NodeKind;
import org.symjl.expr.Slice;
import org.symjl.expr.StateBuffer;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lowering expression DAGs into constant and instruction tables.
 */
@DisplayName("Lowering Pass Tests")
class LoweringPassTest {

    private ExpressionArena arena;
    private LoweringPass pass;

    @BeforeEach
    void setUp() {
        arena = new ExpressionArena();
        pass = new LoweringPass(TreeConstantEvaluator.INSTANCE);
    }

    // ==================== Tables ====================

    @Test
    @DisplayName("A shared subexpression is lowered once")
    void testSharedSubexpression() {
        // GIVEN: y + 1 used by two different parents
        ExpressionNode shared = arena.add(arena.stateVector(0, 3), arena.scalar(1.0));
        ExpressionNode root = arena.add(
                arena.multiply(shared, arena.scalar(2.0)),
                arena.divide(shared, arena.scalar(3.0)));

        // WHEN: We lower the root
        LoweredProgram program = pass.lower(root);

        // THEN: The shared node has a single entry
        long occurrences = program.variableOrder().count(id -> id == shared.id());
        assertEquals(1, occurrences);
        assertEquals(5, program.instructionCount());
        assertEquals(3, program.constantCount());
    }

    @Test
    @DisplayName("Every lowered identity is in exactly one table")
    void testTablesAreDisjoint() {
        ExpressionNode root = arena.concatenate(
                arena.multiply(arena.vector(1.0, 2.0), arena.stateVector(0, 2)),
                arena.add(arena.time(), arena.scalar(4.0)));

        LoweredProgram program = pass.lower(root);

        program.variableOrder().each(id -> assertFalse(program.isConstant(id)));
        program.constants().each(constant -> assertFalse(program.variableOrder().contains(constant.nodeId())));
        for (int id = 0; id < arena.size(); id++) {
            assertTrue(program.isLowered(id), "node " + id + " should be lowered");
        }
    }

    @Test
    @DisplayName("Instructions only read buffers of earlier instructions")
    void testTopologicalOrder() {
        ExpressionNode y = arena.stateVector(0, 2);
        ExpressionNode inner = arena.subtract(arena.multiply(y, y), arena.function("sin", y));
        ExpressionNode root = arena.concatenate(arena.matmul(arena.matrix(new double[][]{{1, 0}, {0, 1}}), inner), y);

        LoweredProgram program = pass.lower(root);

        List<Integer> seen = new ArrayList<>();
        program.variableOrder().each(id -> {
            Instruction instruction = program.instruction(id).orElseThrow();
            for (Operand operand : instruction.operands()) {
                operand.forEachBuffer(buffer -> {
                    if (buffer.kind() == BufferKind.CACHE) {
                        assertTrue(seen.contains(buffer.nodeId()),
                                "node " + id + " reads " + buffer + " before it is computed");
                    }
                });
            }
            seen.add(id);
        });
        assertEquals(root.id(), seen.get(seen.size() - 1));
    }

    @Test
    @DisplayName("Sizes are recorded for constants and variables")
    void testSizes() {
        ExpressionNode v = arena.vector(1.0, 2.0, 3.0);
        ExpressionNode y = arena.stateVector(0, 3);
        ExpressionNode t = arena.time();
        ExpressionNode root = arena.add(arena.multiply(v, y), t);

        LoweredProgram program = pass.lower(root);

        assertEquals(3, program.sizeOf(v.id()));
        assertEquals(3, program.sizeOf(y.id()));
        assertEquals(1, program.sizeOf(t.id()));
        assertEquals(3, program.sizeOf(root.id()));
        assertThrows(IllegalArgumentException.class, () -> program.sizeOf(99));
    }

    // ==================== Constants ====================

    @Test
    @DisplayName("A constant subtree is folded and its children are never lowered")
    void testConstantFolding() {
        ExpressionNode two = arena.scalar(2.0);
        ExpressionNode three = arena.scalar(3.0);
        ExpressionNode root = arena.add(two, three);

        LoweredProgram program = pass.lower(root);

        assertTrue(program.isRootConstant());
        assertEquals(new ScalarValue(5.0), program.constant(root.id()).orElseThrow().value());
        assertFalse(program.isLowered(two.id()));
        assertFalse(program.isLowered(three.id()));
        assertEquals(0, program.instructionCount());
    }

    @Test
    @DisplayName("Scalar constant children are read as literals; arrays through their buffer")
    void testConstantReferences() {
        ExpressionNode y = arena.stateVector(0, 2);
        ExpressionNode scaled = arena.multiply(arena.scalar(0.5), y);
        ExpressionNode shifted = arena.add(scaled, arena.vector(1.0, 2.0));

        LoweredProgram program = pass.lower(shifted);

        Instruction.Infix multiply = (Instruction.Infix) program.instruction(scaled.id()).orElseThrow();
        assertEquals(new Operand.NumberLiteral(0.5), multiply.left());
        Instruction.Infix add = (Instruction.Infix) program.instruction(shifted.id()).orElseThrow();
        assertEquals(Operand.BufferRef.constant(arena.vector(1.0, 2.0).id()), add.right());
        assertEquals(Operand.BufferRef.cache(scaled.id()), add.left());
    }

    @Test
    @DisplayName("A 1x1 dense constant is kept as a number")
    void testUnitMatrixIsScalar() {
        ExpressionNode unit = arena.matrix(new double[][]{{4.0}});
        ExpressionNode root = arena.multiply(unit, arena.stateVector(0, 2));

        LoweredProgram program = pass.lower(root);

        assertEquals(new ScalarValue(4.0), program.constant(unit.id()).orElseThrow().value());
    }

    @Test
    @DisplayName("Constants are rounded unless rounding is switched off")
    void testRounding() {
        ExpressionNode noisy = arena.add(arena.scalar(0.1), arena.scalar(0.2));
        ExpressionNode root = arena.multiply(noisy, arena.time());

        LoweredProgram rounded = pass.lower(root);
        LoweredProgram exact = pass.lower(root, false);

        assertEquals(new ScalarValue(0.3), rounded.constant(noisy.id()).orElseThrow().value());
        assertEquals(new ScalarValue(0.1 + 0.2), exact.constant(noisy.id()).orElseThrow().value());
    }

    @Test
    @DisplayName("A constant subtree that cannot be evaluated is lowered as a variable")
    void testUnevaluableConstant() {
        ExpressionNode special = arena.function("erf", arena.scalar(0.5));
        ExpressionNode root = arena.add(special, arena.time());

        LoweredProgram program = pass.lower(root);

        assertFalse(program.isConstant(special.id()));
        Instruction.Call call = (Instruction.Call) program.instruction(special.id()).orElseThrow();
        assertEquals("erf", call.function());
        assertEquals(List.of(new Operand.NumberLiteral(0.5)), call.arguments());
    }

    // ==================== Node kinds ====================

    @Test
    @DisplayName("Binary operators map to infix, matrix product and reduction forms")
    void testBinaryForms() {
        ExpressionNode y = arena.stateVector(0, 2);
        ExpressionNode m = arena.matrix(new double[][]{{1, 2}, {3, 4}});
        ExpressionNode product = arena.matmul(m, y);
        ExpressionNode lower = arena.minimum(y, arena.scalar(0.0));
        ExpressionNode squared = arena.power(y, arena.scalar(2.0));
        ExpressionNode root = arena.concatenate(product, lower, squared);

        LoweredProgram program = pass.lower(root);

        assertEquals(InstructionForm.MATRIX_PRODUCT, program.instruction(product.id()).orElseThrow().form());
        assertEquals(InstructionForm.REDUCTION, program.instruction(lower.id()).orElseThrow().form());
        assertEquals(InstructionForm.POWER, program.instruction(squared.id()).orElseThrow().form());
        Instruction.Reduction reduction = (Instruction.Reduction) program.instruction(lower.id()).orElseThrow();
        assertEquals(BinaryOperator.MINIMUM, reduction.operator());
    }

    @Test
    @DisplayName("Index [2, 5) becomes the inclusive 1-based range 3:5")
    void testIndexConversion() {
        ExpressionNode y = arena.stateVector(0, 10);
        ExpressionNode index = arena.index(y, 2, 5);

        LoweredProgram program = pass.lower(index);

        Instruction.Index instruction = (Instruction.Index) program.instruction(index.id()).orElseThrow();
        assertEquals(3, instruction.first());
        assertEquals(5, instruction.last());
        assertEquals(3, program.sizeOf(index.id()));
    }

    @Test
    @DisplayName("State selections become 1-based windows; a single entry is a scalar index")
    void testStateWindows() {
        ExpressionNode range = arena.stateVector(2, 5);
        ExpressionNode single = arena.stateVectorDot(1, 2);
        ExpressionNode root = arena.concatenate(range, single);

        LoweredProgram program = pass.lower(root);

        Instruction.StateView window = (Instruction.StateView) program.instruction(range.id()).orElseThrow();
        assertEquals(new Instruction.StateView(StateBuffer.STATE, 3, 5), window);
        assertFalse(window.isSingleEntry());
        assertEquals("@view y[3:5]", window.toString());

        Instruction.StateView entry = (Instruction.StateView) program.instruction(single.id()).orElseThrow();
        assertTrue(entry.isSingleEntry());
        assertEquals("dy[2]", entry.toString());
    }

    @Test
    @DisplayName("A non-contiguous state selection is rejected")
    void testNonContiguousSelection() {
        BitSet mask = new BitSet();
        mask.set(0);
        mask.set(2);
        ExpressionNode gappy = arena.stateVector(StateBuffer.STATE, mask);

        UnsupportedInputException error = assertThrows(UnsupportedInputException.class, () -> pass.lower(gappy));

        assertTrue(error.getReason().contains("non-contiguous"));
    }

    @Test
    @DisplayName("An empty state selection is rejected")
    void testEmptySelection() {
        ExpressionNode empty = arena.stateVector(StateBuffer.STATE, new BitSet());

        assertThrows(UnsupportedInputException.class, () -> pass.lower(empty));
    }

    @Test
    @DisplayName("An undiscretized spatial operator has no lowering rule")
    void testSpatialOperator() {
        ExpressionNode gradient = arena.spatialOperator("grad", arena.stateVector(0, 4));
        ExpressionNode root = arena.add(gradient, arena.scalar(1.0));

        UnsupportedNodeKindException error = assertThrows(UnsupportedNodeKindException.class,
                () -> pass.lower(root));

        assertEquals(NodeKind.SPATIAL_OPERATOR, error.getKind());
        assertTrue(error.getMessage().contains("grad"));
    }

    @Test
    @DisplayName("Concatenation parts carry the size of each child")
    void testConcatenationParts() {
        ExpressionNode root = arena.concatenate(arena.stateVector(0, 3), arena.time(), arena.vector(1.0, 2.0));

        LoweredProgram program = pass.lower(root);

        Instruction.Concatenate concatenate = (Instruction.Concatenate) program.instruction(root.id()).orElseThrow();
        assertEquals(List.of(3, 1, 2), concatenate.parts().stream().map(ConcatenationPart::size).toList());
        assertEquals(6, concatenate.size());
    }

    @Test
    @DisplayName("Domain slices are ordered by target start within each repetition")
    void testDomainOrdering() {
        // GIVEN: Three children whose slices start at 5, 0 and 10 in every repetition
        ExpressionNode a = arena.stateVector(0, 10);
        ExpressionNode b = arena.stateVector(10, 20);
        ExpressionNode c = arena.stateVector(20, 30);
        List<List<DomainSlice>> domains = List.of(
                List.of(domain("a", 5, 20)),
                List.of(domain("b", 0, 15)),
                List.of(domain("c", 10, 25)));
        ExpressionNode root = arena.domainConcatenate(List.of(a, b, c), domains, 2);

        // WHEN: We lower it
        LoweredProgram program = pass.lower(root);

        // THEN: Parts follow spatial order b, a, c in both repetitions
        Instruction.Concatenate concatenate = (Instruction.Concatenate) program.instruction(root.id()).orElseThrow();
        List<Integer> sources = new ArrayList<>();
        for (ConcatenationPart part : concatenate.parts()) {
            Operand.View view = (Operand.View) part.value();
            sources.add(((Operand.BufferRef) view.source()).nodeId());
        }
        assertEquals(List.of(b.id(), a.id(), c.id(), b.id(), a.id(), c.id()), sources);

        Operand.View first = (Operand.View) concatenate.parts().get(0).value();
        assertEquals(1, first.first());
        assertEquals(5, first.last());
        Operand.View second = (Operand.View) concatenate.parts().get(3).value();
        assertEquals(6, second.first());
        assertEquals(10, second.last());
    }

    @Test
    @DisplayName("A single repetition uses children whole and in declaration order")
    void testSingleRepetition() {
        ExpressionNode a = arena.stateVector(0, 2);
        ExpressionNode b = arena.stateVector(2, 5);
        List<List<DomainSlice>> domains = List.of(
                List.of(new DomainSlice("a", List.of(new Slice(0, 2)), List.of(new Slice(3, 5)))),
                List.of(new DomainSlice("b", List.of(new Slice(0, 3)), List.of(new Slice(0, 3)))));
        ExpressionNode root = arena.domainConcatenate(List.of(a, b), domains, 1);

        LoweredProgram program = pass.lower(root);

        Instruction.Concatenate concatenate = (Instruction.Concatenate) program.instruction(root.id()).orElseThrow();
        assertEquals(List.of(Operand.BufferRef.cache(a.id()), Operand.BufferRef.cache(b.id())),
                concatenate.operands());
    }

    // ==================== Consumption ====================

    @Test
    @DisplayName("The instruction queue can be consumed only once")
    void testSingleConsumption() {
        LoweredProgram program = pass.lower(arena.add(arena.stateVector(0, 1), arena.time()));

        assertEquals(3, program.consume().size());
        assertTrue(program.isConsumed());
        assertThrows(IllegalStateException.class, program::consume);
    }

    @Test
    @DisplayName("Constant values in the table match the evaluator")
    void testDenseConstantValue() {
        ExpressionNode v = arena.vector(1.5, -2.5);
        LoweredProgram program = pass.lower(arena.add(v, arena.stateVector(0, 2)));

        assertEquals(DenseMatrixValue.column(1.5, -2.5), program.constant(v.id()).orElseThrow().value());
        assertEquals(1, program.constants().size());
    }

    private static DomainSlice domain(String name, int firstTarget, int secondTarget) {
        return new DomainSlice(name,
                List.of(new Slice(0, 5), new Slice(5, 10)),
                List.of(new Slice(firstTarget, firstTarget + 5), new Slice(secondTarget, secondTarget + 5)));
    }
}
