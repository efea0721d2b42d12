package org.symjl.expr;

import java.util.List;
import java.util.Objects;

/**
 * Selects the half-open row range {@code slice} of its child.
 */
public record IndexNode(int id, ExpressionNode child, Slice slice) implements ExpressionNode {

    public IndexNode {
        Objects.requireNonNull(child, "Child cannot be null");
        Objects.requireNonNull(slice, "Slice cannot be null");
        if (slice.stop() > child.size()) {
            throw new IllegalArgumentException("Slice " + slice + " exceeds child size " + child.size());
        }
    }

    @Override
    public Shape shape() {
        return Shape.vector(slice.length());
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(child);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public String toString() {
        return child + slice.toString();
    }
}
