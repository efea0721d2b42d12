package org.symjl.evaluate;

import org.symjl.expr.ExpressionNode;

/**
 * Decides whether a node is fully determined at compile time and produces
 * its concrete value.
 */
public interface ConstantEvaluator {

    /**
     * @param node The node to inspect
     * @return true if the node depends on neither state, derivative, time nor
     *         input parameters
     */
    boolean isConstant(ExpressionNode node);

    /**
     * Evaluates a constant node.
     * 
     * @param node A node for which {@link #isConstant} holds
     * @return The concrete value
     * @throws ConstantEvaluationException if the value cannot be computed
     */
    ConstantValue evaluate(ExpressionNode node);
}
