package org.symjl.expr;

/**
 * The closed set of expression node kinds.
 */
public enum NodeKind {
    CONSTANT,
    BINARY_OPERATION,
    UNARY_OPERATION,
    INDEX,
    FUNCTION_CALL,
    CONCATENATION,
    DOMAIN_CONCATENATION,
    STATE_VECTOR,
    TIME,
    INPUT_PARAMETER,
    SPATIAL_OPERATOR
}
