package org.symjl.expr;

import java.util.List;
import java.util.Objects;

/**
 * Represents a binary operation between two nodes.
 * 
 * @param id       The node identity
 * @param operator The binary operator
 * @param left     The left operand
 * @param right    The right operand
 * @param shape    The result shape
 */
public record BinaryOperation(
        int id,
        BinaryOperator operator,
        ExpressionNode left,
        ExpressionNode right,
        Shape shape) implements ExpressionNode {

    public BinaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        Objects.requireNonNull(shape, "Shape cannot be null");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(left, right);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OPERATION;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
