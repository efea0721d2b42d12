package org.symjl.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A named external function applied to its children in order.
 * 
 * @param id       The node identity
 * @param function The function name in the target dialect (e.g. "exp")
 * @param children The arguments
 * @param shape    The result shape
 */
public record FunctionCall(int id, String function, List<ExpressionNode> children, Shape shape)
        implements ExpressionNode {

    public FunctionCall {
        Objects.requireNonNull(function, "Function name cannot be null");
        Objects.requireNonNull(shape, "Shape cannot be null");
        children = List.copyOf(children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Function '" + function + "' requires at least one argument");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return function + "(" + children.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
