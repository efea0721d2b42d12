package org.symjl.evaluate;

import org.eclipse.collections.api.factory.primitive.IntObjectMaps;
import org.eclipse.collections.api.factory.primitive.IntSets;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.api.set.primitive.MutableIntSet;
import org.symjl.expr.BinaryOperation;
import org.symjl.expr.BinaryOperator;
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
import org.symjl.expr.UnaryOperator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Reference {@link ConstantEvaluator} that folds constant subtrees in plain
 * Java arithmetic.
 * 
 * Stateless: every call works on its own memo tables, so one instance can
 * serve any number of compilations.
 */
public final class TreeConstantEvaluator implements ConstantEvaluator {

    public static final TreeConstantEvaluator INSTANCE = new TreeConstantEvaluator();

    private TreeConstantEvaluator() {
        // Singleton
    }

    @Override
    public boolean isConstant(ExpressionNode node) {
        MutableIntSet seen = IntSets.mutable.empty();
        Deque<ExpressionNode> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            ExpressionNode current = pending.pop();
            if (!seen.add(current.id())) {
                continue;
            }
            NodeKind kind = current.kind();
            if (kind == NodeKind.STATE_VECTOR || kind == NodeKind.TIME || kind == NodeKind.INPUT_PARAMETER) {
                return false;
            }
            current.children().forEach(pending::push);
        }
        return true;
    }

    @Override
    public ConstantValue evaluate(ExpressionNode node) {
        return node.accept(new Folder());
    }

    private static final class Folder implements ExpressionVisitor<ConstantValue> {

        private final MutableIntObjectMap<ConstantValue> memo = IntObjectMaps.mutable.empty();

        private ConstantValue fold(ExpressionNode node) {
            ConstantValue known = memo.get(node.id());
            if (known == null) {
                known = node.accept(this);
                memo.put(node.id(), known);
            }
            return known;
        }

        @Override
        public ConstantValue visitConstant(ConstantNode constant) {
            return constant.value();
        }

        @Override
        public ConstantValue visitBinary(BinaryOperation binary) {
            ConstantValue left = fold(binary.left());
            ConstantValue right = fold(binary.right());
            BinaryOperator operator = binary.operator();
            if (left instanceof ScalarValue a && right instanceof ScalarValue b) {
                return new ScalarValue(scalarOperator(operator).applyAsDouble(a.value(), b.value()));
            }
            if (operator == BinaryOperator.MATRIX_MULTIPLY) {
                DenseMatrixValue product = matmul(left.toDense(), right.toDense());
                return left instanceof SparseMatrixValue && right instanceof SparseMatrixValue
                        ? SparseMatrixValue.fromDense(product)
                        : product;
            }
            DenseMatrixValue result = broadcast(left, right, scalarOperator(operator));
            return keepsSparsity(operator, left, right) ? SparseMatrixValue.fromDense(result) : result;
        }

        @Override
        public ConstantValue visitUnary(UnaryOperation unary) {
            ConstantValue child = fold(unary.child());
            DoubleUnaryOperator function = unary.operator() == UnaryOperator.NEGATE
                    ? x -> -x
                    : x -> x == 0.0 ? 1.0 : 0.0;
            if (child instanceof ScalarValue scalar) {
                return new ScalarValue(function.applyAsDouble(scalar.value()));
            }
            DenseMatrixValue result = map(child.toDense(), function);
            return child instanceof SparseMatrixValue && unary.operator() == UnaryOperator.NEGATE
                    ? SparseMatrixValue.fromDense(result)
                    : result;
        }

        @Override
        public ConstantValue visitIndex(IndexNode index) {
            DenseMatrixValue child = fold(index.child()).toDense();
            Slice slice = index.slice();
            double[] data = new double[slice.length() * child.columns()];
            for (int r = slice.start(); r < slice.stop(); r++) {
                for (int c = 0; c < child.columns(); c++) {
                    data[(r - slice.start()) * child.columns() + c] = child.get(r, c);
                }
            }
            return new DenseMatrixValue(slice.length(), child.columns(), data);
        }

        @Override
        public ConstantValue visitFunctionCall(FunctionCall call) {
            DoubleUnaryOperator function = ScalarFunctions.lookup(call.function())
                    .orElseThrow(() -> new ConstantEvaluationException(
                            "Cannot evaluate function '" + call.function() + "' at compile time"));
            if (call.children().size() != 1) {
                throw new ConstantEvaluationException("Function '" + call.function() + "' expects 1 argument but got "
                        + call.children().size());
            }
            ConstantValue argument = fold(call.children().get(0));
            if (argument instanceof ScalarValue scalar) {
                return new ScalarValue(function.applyAsDouble(scalar.value()));
            }
            return map(argument.toDense(), function);
        }

        @Override
        public ConstantValue visitConcatenation(Concatenation concatenation) {
            List<DenseMatrixValue> parts = concatenation.children().stream()
                    .map(child -> fold(child).toDense())
                    .toList();
            int columns = parts.get(0).columns();
            int rows = 0;
            for (DenseMatrixValue part : parts) {
                if (part.columns() != columns) {
                    throw new ConstantEvaluationException("Cannot concatenate blocks with " + columns
                            + " and " + part.columns() + " columns");
                }
                rows += part.rows();
            }
            double[] data = new double[rows * columns];
            int offset = 0;
            for (DenseMatrixValue part : parts) {
                System.arraycopy(part.data(), 0, data, offset, part.rows() * columns);
                offset += part.rows() * columns;
            }
            return new DenseMatrixValue(rows, columns, data);
        }

        @Override
        public ConstantValue visitDomainConcatenation(DomainConcatenation concatenation) {
            double[] data = new double[concatenation.size()];
            for (int k = 0; k < concatenation.children().size(); k++) {
                double[] child = fold(concatenation.children().get(k)).toDense().data();
                for (DomainSlice domain : concatenation.childDomains().get(k)) {
                    for (int i = 0; i < domain.repetitions(); i++) {
                        Slice source = domain.childSlices().get(i);
                        Slice target = domain.targetSlices().get(i);
                        System.arraycopy(child, source.start(), data, target.start(), source.length());
                    }
                }
            }
            return DenseMatrixValue.column(data);
        }

        @Override
        public ConstantValue visitStateVector(StateVectorReference stateVector) {
            throw new ConstantEvaluationException("State vector reference depends on run-time values");
        }

        @Override
        public ConstantValue visitTime(TimeReference time) {
            throw new ConstantEvaluationException("Time depends on run-time values");
        }

        @Override
        public ConstantValue visitInputParameter(InputParameterReference parameter) {
            throw new ConstantEvaluationException("Input parameter '" + parameter.name() + "' is supplied at call time");
        }

        @Override
        public ConstantValue visitSpatialOperator(SpatialOperator operator) {
            throw new ConstantEvaluationException("Spatial operator '" + operator.name() + "' has not been discretized");
        }
    }

    private static DoubleBinaryOperator scalarOperator(BinaryOperator operator) {
        return switch (operator) {
            case ADD -> Double::sum;
            case SUBTRACT -> (a, b) -> a - b;
            case MULTIPLY, INNER, MATRIX_MULTIPLY -> (a, b) -> a * b;
            case DIVIDE -> (a, b) -> a / b;
            case MINIMUM -> Math::min;
            case MAXIMUM -> Math::max;
            case POWER -> Math::pow;
            case EQUAL -> (a, b) -> a == b ? 1.0 : 0.0;
            case LESS -> (a, b) -> a < b ? 1.0 : 0.0;
            case LESS_EQUAL -> (a, b) -> a <= b ? 1.0 : 0.0;
            case GREATER -> (a, b) -> a > b ? 1.0 : 0.0;
            case GREATER_EQUAL -> (a, b) -> a >= b ? 1.0 : 0.0;
            case MODULO -> (a, b) -> a % b;
        };
    }

    private static boolean keepsSparsity(BinaryOperator operator, ConstantValue left, ConstantValue right) {
        boolean leftSparse = left instanceof SparseMatrixValue;
        boolean rightSparse = right instanceof SparseMatrixValue;
        return switch (operator) {
            case ADD, SUBTRACT -> leftSparse && rightSparse;
            case MULTIPLY, INNER -> (leftSparse && !(right instanceof DenseMatrixValue))
                    || (rightSparse && !(left instanceof DenseMatrixValue));
            case DIVIDE -> leftSparse && right instanceof ScalarValue;
            default -> false;
        };
    }

    private static DenseMatrixValue broadcast(ConstantValue left, ConstantValue right, DoubleBinaryOperator op) {
        if (left instanceof ScalarValue scalar) {
            double a = scalar.value();
            return map(right.toDense(), b -> op.applyAsDouble(a, b));
        }
        if (right instanceof ScalarValue scalar) {
            double b = scalar.value();
            return map(left.toDense(), a -> op.applyAsDouble(a, b));
        }
        DenseMatrixValue a = left.toDense();
        DenseMatrixValue b = right.toDense();
        if (a.rows() != b.rows() || a.columns() != b.columns()) {
            throw new ConstantEvaluationException("Shape mismatch: " + a.shape() + " and " + b.shape());
        }
        double[] x = a.data();
        double[] y = b.data();
        double[] data = new double[x.length];
        for (int i = 0; i < data.length; i++) {
            data[i] = op.applyAsDouble(x[i], y[i]);
        }
        return new DenseMatrixValue(a.rows(), a.columns(), data);
    }

    private static DenseMatrixValue map(DenseMatrixValue value, DoubleUnaryOperator function) {
        double[] data = value.data();
        for (int i = 0; i < data.length; i++) {
            data[i] = function.applyAsDouble(data[i]);
        }
        return new DenseMatrixValue(value.rows(), value.columns(), data);
    }

    private static DenseMatrixValue matmul(DenseMatrixValue left, DenseMatrixValue right) {
        if (left.columns() != right.rows()) {
            throw new ConstantEvaluationException("Cannot multiply " + left.shape() + " by " + right.shape());
        }
        double[] data = new double[left.rows() * right.columns()];
        for (int i = 0; i < left.rows(); i++) {
            for (int k = 0; k < left.columns(); k++) {
                double a = left.get(i, k);
                if (a == 0.0) {
                    continue;
                }
                for (int j = 0; j < right.columns(); j++) {
                    data[i * right.columns() + j] += a * right.get(k, j);
                }
            }
        }
        return new DenseMatrixValue(left.rows(), right.columns(), data);
    }
}
