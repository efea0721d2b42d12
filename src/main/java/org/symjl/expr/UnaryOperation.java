package org.symjl.expr;

import java.util.List;
import java.util.Objects;

/**
 * Represents an elementwise unary operation.
 */
public record UnaryOperation(int id, UnaryOperator operator, ExpressionNode child) implements ExpressionNode {

    public UnaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(child, "Child cannot be null");
    }

    @Override
    public Shape shape() {
        return child.shape();
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(child);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OPERATION;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator.symbol() + child;
    }
}
