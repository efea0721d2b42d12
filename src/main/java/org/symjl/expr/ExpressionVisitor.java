package org.symjl.expr;

/**
 * Visitor interface for traversing expression DAGs.
 * 
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitConstant(ConstantNode constant);

    T visitBinary(BinaryOperation binary);

    T visitUnary(UnaryOperation unary);

    T visitIndex(IndexNode index);

    T visitFunctionCall(FunctionCall call);

    T visitConcatenation(Concatenation concatenation);

    /**
     * Visit a concatenation whose children are ordered by subdomain.
     */
    T visitDomainConcatenation(DomainConcatenation concatenation);

    T visitStateVector(StateVectorReference stateVector);

    T visitTime(TimeReference time);

    T visitInputParameter(InputParameterReference parameter);

    /**
     * Visit an undiscretized spatial operator.
     */
    T visitSpatialOperator(SpatialOperator operator);
}
