package org.symjl.expr;

import org.symjl.evaluate.ConstantValue;

import java.util.List;
import java.util.Objects;

/**
 * A leaf holding a value known at compile time.
 */
public record ConstantNode(int id, ConstantValue value) implements ExpressionNode {

    public ConstantNode {
        Objects.requireNonNull(value, "Value cannot be null");
    }

    @Override
    public Shape shape() {
        return value.shape();
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
