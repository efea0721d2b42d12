package org.symjl.expr;

import java.util.List;
import java.util.Objects;

/**
 * A named scalar supplied by the caller at call time.
 */
public record InputParameterReference(int id, String name) implements ExpressionNode {

    public InputParameterReference {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be blank");
        }
    }

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
        return NodeKind.INPUT_PARAMETER;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitInputParameter(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
