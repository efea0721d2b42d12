package org.symjl.expr;

import java.util.List;

/**
 * The scalar elapsed time.
 */
public record TimeReference(int id) implements ExpressionNode {

    @Override
    public Shape shape() {
        return Shape.ofScalar();
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TIME;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitTime(this);
    }

    @Override
    public String toString() {
        return "t";
    }
}
