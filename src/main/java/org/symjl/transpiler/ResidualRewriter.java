package org.symjl.transpiler;

import org.symjl.expr.Concatenation;
import org.symjl.expr.ExpressionArena;
import org.symjl.expr.ExpressionNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the right-hand side of a semi-explicit DAE into an implicit
 * residual.
 * 
 * The top-level children of the root are split by cumulative size. A child
 * lying entirely within the first {@code differentialCount} entries becomes
 * {@code child - dy[start:end]}; any other child is an algebraic constraint
 * and is kept unchanged.
 */
public final class ResidualRewriter {

    private final ExpressionArena arena;

    public ResidualRewriter(ExpressionArena arena) {
        this.arena = Objects.requireNonNull(arena, "Arena cannot be null");
    }

    public ExpressionNode rewrite(ExpressionNode root, int differentialCount) {
        Objects.requireNonNull(root, "Root cannot be null");
        if (differentialCount < 0) {
            throw new IllegalArgumentException("Differential count cannot be negative: " + differentialCount);
        }
        List<ExpressionNode> children = root instanceof Concatenation ? root.children() : List.of(root);
        List<ExpressionNode> residuals = new ArrayList<>(children.size());
        int end = 0;
        for (ExpressionNode child : children) {
            int start = end;
            end += child.size();
            if (end <= differentialCount && end > start) {
                residuals.add(arena.subtract(child, arena.stateVectorDot(start, end)));
            } else {
                residuals.add(child);
            }
        }
        return arena.concatenate(residuals);
    }
}
