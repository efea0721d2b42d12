package org.symjl.expr;

import java.util.List;

/**
 * Sealed interface representing a node of an immutable expression DAG.
 * 
 * Nodes are created by an {@link ExpressionArena}, which assigns each
 * structurally distinct subexpression a unique integer identity. Two nodes
 * with the same identity are the same subexpression, so sharing is detected
 * by comparing identities rather than structure.
 */
public sealed interface ExpressionNode
        permits ConstantNode, BinaryOperation, UnaryOperation, IndexNode, FunctionCall, Concatenation,
        DomainConcatenation, StateVectorReference, TimeReference, InputParameterReference, SpatialOperator {

    /**
     * @return The stable identity of this subexpression
     */
    int id();

    Shape shape();

    /**
     * @return The child nodes, empty for leaves
     */
    List<ExpressionNode> children();

    NodeKind kind();

    /**
     * Accept method for the expression visitor pattern.
     * 
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * @return 1 for scalars, otherwise the first dimension of the shape
     */
    default int size() {
        return shape().size();
    }
}
