package org.symjl.lowering;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.factory.primitive.IntObjectMaps;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.symjl.evaluate.ConstantEvaluationException;
import org.symjl.evaluate.ConstantEvaluator;
import org.symjl.evaluate.ConstantRounding;
import org.symjl.evaluate.ConstantValue;
import org.symjl.evaluate.DenseMatrixValue;
import org.symjl.evaluate.ScalarValue;
import org.symjl.expr.BinaryOperation;
import org.symjl.expr.Concatenation;
import org.symjl.expr.ConstantNode;
import org.symjl.expr.DomainConcatenation;
import org.symjl.expr.DomainSlice;
import org.symjl.expr.ExpressionNode;
import org.symjl.expr.ExpressionVisitor;
import org.symjl.expr.FunctionCall;
import org.symjl.expr.IndexNode;
import org.symjl.expr.InputParameterReference;
import org.symjl.expr.NodeKind;
import org.symjl.expr.Slice;
import org.symjl.expr.SpatialOperator;
import org.symjl.expr.StateVectorReference;
import org.symjl.expr.TimeReference;
import org.symjl.expr.UnaryOperation;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lowers an expression DAG into a {@link LoweredProgram}.
 *
 * Architecture:
 * - ExpressionNode DAG → LoweringPass → LoweredProgram → JuliaCodeGenerator → procedure text
 *
 * The traversal is post-order and memoized by node identity:
 * 1. A node already in either table is skipped, so shared subtrees are
 *    lowered once
 * 2. A constant node that can be evaluated goes to the constant table;
 *    its children are never visited
 * 3. Otherwise children are lowered first, then the node's instruction is
 *    appended to the variable table
 */
public final class LoweringPass {

    private static final Logger LOGGER = LogManager.getLogger(LoweringPass.class);

    private final ConstantEvaluator evaluator;
    private final int roundingDecimals;

    public LoweringPass(ConstantEvaluator evaluator) {
        this(evaluator, ConstantRounding.DEFAULT_DECIMALS);
    }

    public LoweringPass(ConstantEvaluator evaluator, int roundingDecimals) {
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        if (roundingDecimals < 0) {
            throw new IllegalArgumentException("Rounding decimals cannot be negative: " + roundingDecimals);
        }
        this.roundingDecimals = roundingDecimals;
    }

    /**
     * Lowers a DAG with constant rounding enabled.
     */
    public LoweredProgram lower(ExpressionNode root) {
        return lower(root, true);
    }

    /**
     * Lowers a DAG into its constant, variable and size tables.
     *
     * @param root           The root of the DAG
     * @param roundConstants Whether constant values are rounded before
     *                       emission
     * @return The lowered tables
     * @throws UnsupportedNodeKindException if the DAG contains a node kind
     *                                      with no code generation rule
     * @throws UnsupportedInputException    if a node carries data that cannot
     *                                      be expressed
     */
    public LoweredProgram lower(ExpressionNode root, boolean roundConstants) {
        Objects.requireNonNull(root, "Root cannot be null");
        Context context = new Context(new LoweredProgram(root.id()), roundConstants);
        context.lower(root);
        LOGGER.debug("Lowered root {} into {} constants and {} instructions",
                root.id(), context.program.constantCount(), context.program.instructionCount());
        return context.program;
    }

    /**
     * State of a single lowering call.
     */
    private final class Context implements ExpressionVisitor<Instruction> {

        private final LoweredProgram program;
        private final boolean roundConstants;
        private final MutableIntObjectMap<Optional<ConstantValue>> constantValues = IntObjectMaps.mutable.empty();

        private Context(LoweredProgram program, boolean roundConstants) {
            this.program = program;
            this.roundConstants = roundConstants;
        }

        void lower(ExpressionNode node) {
            if (program.isLowered(node.id())) {
                return;
            }
            Optional<ConstantValue> value = constantValue(node);
            if (value.isPresent()) {
                program.addConstant(node.id(), value.get(), node.size());
                return;
            }
            for (ExpressionNode child : node.children()) {
                lower(child);
            }
            program.addInstruction(node.id(), node.accept(this), node.size());
        }

        private Optional<ConstantValue> constantValue(ExpressionNode node) {
            Optional<ConstantValue> known = constantValues.get(node.id());
            if (known != null) {
                return known;
            }
            Optional<ConstantValue> value = Optional.empty();
            if (evaluator.isConstant(node)) {
                try {
                    ConstantValue evaluated = classify(evaluator.evaluate(node));
                    value = Optional.of(roundConstants ? ConstantRounding.round(evaluated, roundingDecimals) : evaluated);
                } catch (ConstantEvaluationException e) {
                    LOGGER.debug("Lowering constant node {} as a variable: {}", node.id(), e.getMessage());
                }
            }
            constantValues.put(node.id(), value);
            return value;
        }

        private ConstantValue classify(ConstantValue value) {
            // a 1x1 dense value is written as a plain number
            if (value instanceof DenseMatrixValue dense && dense.rows() == 1 && dense.columns() == 1) {
                return new ScalarValue(dense.get(0, 0));
            }
            return value;
        }

        /**
         * The operand through which a parent reads a lowered child: a number
         * for scalar constants, otherwise the child's buffer.
         */
        private Operand reference(ExpressionNode child) {
            if (program.isConstant(child.id())) {
                ConstantValue value = constantValue(child).orElseThrow();
                return value instanceof ScalarValue scalar
                        ? new Operand.NumberLiteral(scalar.value())
                        : Operand.BufferRef.constant(child.id());
            }
            return Operand.BufferRef.cache(child.id());
        }

        // ==================== Node kinds ====================

        @Override
        public Instruction visitConstant(ConstantNode constant) {
            throw new UnsupportedNodeKindException(NodeKind.CONSTANT,
                    "the constant evaluator could not produce a value for node " + constant.id());
        }

        @Override
        public Instruction visitBinary(BinaryOperation binary) {
            Operand left = reference(binary.left());
            Operand right = reference(binary.right());
            return switch (binary.operator()) {
                case MATRIX_MULTIPLY -> new Instruction.MatrixProduct(left, right);
                case MINIMUM, MAXIMUM -> new Instruction.Reduction(binary.operator(), left, right);
                default -> new Instruction.Infix(binary.operator(), left, right);
            };
        }

        @Override
        public Instruction visitUnary(UnaryOperation unary) {
            return new Instruction.Prefix(unary.operator(), reference(unary.child()));
        }

        @Override
        public Instruction visitIndex(IndexNode index) {
            // [start, stop) becomes the 1-based inclusive range start+1:stop
            Slice slice = index.slice();
            return new Instruction.Index(reference(index.child()), slice.start() + 1, slice.stop());
        }

        @Override
        public Instruction visitFunctionCall(FunctionCall call) {
            return new Instruction.Call(call.function(), call.children().stream().map(this::reference).toList());
        }

        @Override
        public Instruction visitConcatenation(Concatenation concatenation) {
            List<ConcatenationPart> parts = new ArrayList<>();
            for (ExpressionNode child : concatenation.children()) {
                parts.add(new ConcatenationPart(program.sizeOf(child.id()), reference(child)));
            }
            return new Instruction.Concatenate(parts);
        }

        @Override
        public Instruction visitDomainConcatenation(DomainConcatenation concatenation) {
            List<ExpressionNode> children = concatenation.children();
            List<ConcatenationPart> parts = new ArrayList<>();
            if (concatenation.secondaryPoints() == 1) {
                for (ExpressionNode child : children) {
                    parts.add(new ConcatenationPart(program.sizeOf(child.id()), reference(child)));
                }
                return new Instruction.Concatenate(parts);
            }
            record Placed(int targetStart, ConcatenationPart part) {
            }
            for (int i = 0; i < concatenation.secondaryPoints(); i++) {
                List<Placed> repetition = new ArrayList<>();
                for (int k = 0; k < children.size(); k++) {
                    Operand source = reference(children.get(k));
                    for (DomainSlice domain : concatenation.childDomains().get(k)) {
                        Slice childSlice = domain.childSlices().get(i);
                        Operand window = new Operand.View(source, childSlice.start() + 1, childSlice.stop());
                        repetition.add(new Placed(domain.targetSlices().get(i).start(),
                                new ConcatenationPart(childSlice.length(), window)));
                    }
                }
                // spatial order, independent of child declaration order
                repetition.sort(Comparator.comparingInt(Placed::targetStart));
                repetition.forEach(placed -> parts.add(placed.part()));
            }
            return new Instruction.Concatenate(parts);
        }

        @Override
        public Instruction visitStateVector(StateVectorReference stateVector) {
            BitSet selection = stateVector.selection();
            if (selection.isEmpty()) {
                throw new UnsupportedInputException("state vector reference " + stateVector.id() + " selects no entries");
            }
            int first = selection.nextSetBit(0);
            int last = selection.length() - 1;
            if (selection.cardinality() != last - first + 1) {
                throw new UnsupportedInputException("state vector reference " + stateVector.id()
                        + " has a non-contiguous selection " + selection);
            }
            return new Instruction.StateView(stateVector.buffer(), first + 1, last + 1);
        }

        @Override
        public Instruction visitTime(TimeReference time) {
            return new Instruction.Time();
        }

        @Override
        public Instruction visitInputParameter(InputParameterReference parameter) {
            return new Instruction.InputParameter(parameter.name());
        }

        @Override
        public Instruction visitSpatialOperator(SpatialOperator operator) {
            throw new UnsupportedNodeKindException(NodeKind.SPATIAL_OPERATOR,
                    "'" + operator.name() + "' must be discretized before code generation");
        }
    }
}
