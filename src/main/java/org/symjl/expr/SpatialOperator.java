package org.symjl.expr;

import java.util.List;
import java.util.Objects;

/**
 * An undiscretized spatial operator such as {@code grad} or {@code div}.
 * 
 * These must be replaced by matrices during discretization; code
 * generation rejects them.
 */
public record SpatialOperator(int id, String name, ExpressionNode child) implements ExpressionNode {

    public SpatialOperator {
        Objects.requireNonNull(name, "Operator name cannot be null");
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
        return NodeKind.SPATIAL_OPERATOR;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitSpatialOperator(this);
    }

    @Override
    public String toString() {
        return name + "(" + child + ")";
    }
}
