package org.symjl.expr;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Reads the positions selected by {@code selection} from the state vector or
 * its time derivative.
 * 
 * The selection is copied on construction and on access, so the record stays
 * immutable.
 */
public record StateVectorReference(int id, StateBuffer buffer, BitSet selection) implements ExpressionNode {

    public StateVectorReference {
        Objects.requireNonNull(buffer, "Buffer cannot be null");
        selection = (BitSet) Objects.requireNonNull(selection, "Selection cannot be null").clone();
    }

    @Override
    public BitSet selection() {
        return (BitSet) selection.clone();
    }

    @Override
    public Shape shape() {
        return Shape.vector(selection.cardinality());
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STATE_VECTOR;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitStateVector(this);
    }

    @Override
    public String toString() {
        return buffer.symbol() + selection;
    }
}
