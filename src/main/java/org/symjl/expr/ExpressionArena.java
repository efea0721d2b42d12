package org.symjl.expr;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.symjl.evaluate.ConstantValue;
import org.symjl.evaluate.DenseMatrixValue;
import org.symjl.evaluate.ScalarValue;
import org.symjl.evaluate.SparseMatrixValue;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Creates expression nodes and assigns their identities.
 * 
 * Nodes are interned by kind, payload and child identities, so building the
 * same subexpression twice through one arena yields the same node and the
 * same identity. Identities are dense integers starting at 0 and can be
 * resolved back with {@link #node(int)}.
 * 
 * Not thread-safe; build a DAG from a single thread, then share it freely.
 * 
 * Example:
 * 
 * <pre>
 * ExpressionArena arena = new ExpressionArena();
 * ExpressionNode y = arena.stateVector(0, 3);
 * ExpressionNode rhs = arena.add(arena.scalar(1.0), arena.negate(y));
 * </pre>
 */
public final class ExpressionArena {

    private final MutableList<ExpressionNode> nodes = Lists.mutable.empty();
    private final MutableMap<NodeKey, ExpressionNode> interned = Maps.mutable.empty();

    private record NodeKey(NodeKind kind, List<Object> payload, List<Integer> childIds) {
    }

    /**
     * @return The node with the given identity
     */
    public ExpressionNode node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("Unknown node identity: " + id);
        }
        return nodes.get(id);
    }

    /**
     * @return The number of distinct nodes created so far
     */
    public int size() {
        return nodes.size();
    }

    // ==================== Constants ====================

    public ExpressionNode constant(ConstantValue value) {
        Objects.requireNonNull(value, "Value cannot be null");
        return intern(NodeKind.CONSTANT, List.of(value), List.of(), id -> new ConstantNode(id, value));
    }

    public ExpressionNode scalar(double value) {
        return constant(new ScalarValue(value));
    }

    public ExpressionNode vector(double... values) {
        return constant(DenseMatrixValue.column(values));
    }

    public ExpressionNode matrix(double[][] values) {
        return constant(DenseMatrixValue.of(values));
    }

    public ExpressionNode sparse(int rows, int columns, int[] rowIndices, int[] columnIndices, double[] values) {
        return constant(new SparseMatrixValue(rows, columns, rowIndices, columnIndices, values));
    }

    // ==================== Operators ====================

    public ExpressionNode add(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.ADD, left, right);
    }

    public ExpressionNode subtract(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.SUBTRACT, left, right);
    }

    public ExpressionNode multiply(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.MULTIPLY, left, right);
    }

    public ExpressionNode divide(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.DIVIDE, left, right);
    }

    public ExpressionNode matmul(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.MATRIX_MULTIPLY, left, right);
    }

    public ExpressionNode inner(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.INNER, left, right);
    }

    public ExpressionNode minimum(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.MINIMUM, left, right);
    }

    public ExpressionNode maximum(ExpressionNode left, ExpressionNode right) {
        return binary(BinaryOperator.MAXIMUM, left, right);
    }

    public ExpressionNode power(ExpressionNode base, ExpressionNode exponent) {
        return binary(BinaryOperator.POWER, base, exponent);
    }

    public ExpressionNode binary(BinaryOperator operator, ExpressionNode left, ExpressionNode right) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Shape shape = operator == BinaryOperator.MATRIX_MULTIPLY
                ? productShape(left.shape(), right.shape())
                : broadcastShape(left.shape(), right.shape());
        return intern(NodeKind.BINARY_OPERATION, List.of(operator), childIds(left, right),
                id -> new BinaryOperation(id, operator, left, right, shape));
    }

    public ExpressionNode negate(ExpressionNode child) {
        return unary(UnaryOperator.NEGATE, child);
    }

    public ExpressionNode unary(UnaryOperator operator, ExpressionNode child) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        return intern(NodeKind.UNARY_OPERATION, List.of(operator), childIds(child),
                id -> new UnaryOperation(id, operator, child));
    }

    /**
     * Selects rows {@code [start, stop)} of {@code child}.
     */
    public ExpressionNode index(ExpressionNode child, int start, int stop) {
        Slice slice = new Slice(start, stop);
        return intern(NodeKind.INDEX, List.of(slice), childIds(child), id -> new IndexNode(id, child, slice));
    }

    public ExpressionNode function(String name, ExpressionNode... arguments) {
        Objects.requireNonNull(name, "Function name cannot be null");
        List<ExpressionNode> children = List.of(arguments);
        Shape shape = children.stream().map(ExpressionNode::shape)
                .reduce(Shape.ofScalar(), ExpressionArena::broadcastShape);
        return intern(NodeKind.FUNCTION_CALL, List.of(name), childIds(arguments),
                id -> new FunctionCall(id, name, children, shape));
    }

    // ==================== Concatenations ====================

    /**
     * Concatenates children vertically. A single child is returned as is.
     */
    public ExpressionNode concatenate(List<ExpressionNode> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Concatenation requires at least one child");
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return intern(NodeKind.CONCATENATION, List.of(), childIds(children.toArray(new ExpressionNode[0])),
                id -> new Concatenation(id, children));
    }

    public ExpressionNode concatenate(ExpressionNode... children) {
        return concatenate(List.of(children));
    }

    public ExpressionNode domainConcatenate(List<ExpressionNode> children, List<List<DomainSlice>> childDomains,
                                            int secondaryPoints) {
        return intern(NodeKind.DOMAIN_CONCATENATION, List.of(childDomains, secondaryPoints),
                childIds(children.toArray(new ExpressionNode[0])),
                id -> new DomainConcatenation(id, children, childDomains, secondaryPoints));
    }

    // ==================== Leaves ====================

    /**
     * References entries {@code [start, stop)} of the state vector.
     */
    public ExpressionNode stateVector(int start, int stop) {
        return stateVector(StateBuffer.STATE, range(start, stop));
    }

    /**
     * References entries {@code [start, stop)} of the state derivative.
     */
    public ExpressionNode stateVectorDot(int start, int stop) {
        return stateVector(StateBuffer.DERIVATIVE, range(start, stop));
    }

    public ExpressionNode stateVector(StateBuffer buffer, BitSet selection) {
        Objects.requireNonNull(buffer, "Buffer cannot be null");
        BitSet copy = (BitSet) selection.clone();
        return intern(NodeKind.STATE_VECTOR, List.of(buffer, copy), List.of(),
                id -> new StateVectorReference(id, buffer, copy));
    }

    public ExpressionNode time() {
        return intern(NodeKind.TIME, List.of(), List.of(), TimeReference::new);
    }

    public ExpressionNode inputParameter(String name) {
        return intern(NodeKind.INPUT_PARAMETER, List.of(name), List.of(),
                id -> new InputParameterReference(id, name));
    }

    public ExpressionNode spatialOperator(String name, ExpressionNode child) {
        return intern(NodeKind.SPATIAL_OPERATOR, List.of(name), childIds(child),
                id -> new SpatialOperator(id, name, child));
    }

    // ==================== Helpers ====================

    private ExpressionNode intern(NodeKind kind, List<Object> payload, List<Integer> childIds,
                                  IntFunction<ExpressionNode> factory) {
        NodeKey key = new NodeKey(kind, payload, childIds);
        ExpressionNode existing = interned.get(key);
        if (existing != null) {
            return existing;
        }
        ExpressionNode created = factory.apply(nodes.size());
        nodes.add(created);
        interned.put(key, created);
        return created;
    }

    private List<Integer> childIds(ExpressionNode... children) {
        for (ExpressionNode child : children) {
            Objects.requireNonNull(child, "Child cannot be null");
            if (child.id() >= nodes.size() || nodes.get(child.id()) != child) {
                throw new IllegalArgumentException("Node " + child + " does not belong to this arena");
            }
        }
        return Arrays.stream(children).map(ExpressionNode::id).toList();
    }

    private static BitSet range(int start, int stop) {
        if (start < 0 || stop <= start) {
            throw new IllegalArgumentException("Invalid state range [" + start + ", " + stop + ")");
        }
        BitSet selection = new BitSet(stop);
        selection.set(start, stop);
        return selection;
    }

    static Shape broadcastShape(Shape left, Shape right) {
        if (isUnit(left)) {
            return right;
        }
        if (isUnit(right)) {
            return left;
        }
        if (left.rows() != right.rows() || left.columns() != right.columns()) {
            throw new IllegalArgumentException("Cannot broadcast shapes " + left + " and " + right);
        }
        return left;
    }

    private static Shape productShape(Shape left, Shape right) {
        if (left.scalar() || right.scalar()) {
            return broadcastShape(left, right);
        }
        if (left.columns() != right.rows()) {
            throw new IllegalArgumentException("Cannot multiply shapes " + left + " and " + right);
        }
        return Shape.matrix(left.rows(), right.columns());
    }

    private static boolean isUnit(Shape shape) {
        return shape.scalar() || (shape.rows() == 1 && shape.columns() == 1);
    }
}
