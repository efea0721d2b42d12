package org.symjl.expr;

import java.util.List;

/**
 * Vertical concatenation of its children in declaration order.
 */
public record Concatenation(int id, List<ExpressionNode> children) implements ExpressionNode {

    public Concatenation {
        children = List.copyOf(children);
        if (children.size() < 2) {
            throw new IllegalArgumentException("Concatenation requires at least 2 children");
        }
    }

    @Override
    public Shape shape() {
        return Shape.vector(children.stream().mapToInt(ExpressionNode::size).sum());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONCATENATION;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConcatenation(this);
    }

    @Override
    public String toString() {
        return "concat" + children;
    }
}
