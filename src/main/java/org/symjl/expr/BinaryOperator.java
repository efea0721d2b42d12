package org.symjl.expr;

/**
 * Binary operators supported by {@link BinaryOperation}.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MATRIX_MULTIPLY("@"),
    /** Elementwise product of two arrays of the same shape. */
    INNER("*"),
    MINIMUM("min"),
    MAXIMUM("max"),
    POWER("^"),
    EQUAL("=="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    MODULO("%");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The infix symbol, or the function name for min/max
     */
    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return this == EQUAL || this == LESS || this == LESS_EQUAL
                || this == GREATER || this == GREATER_EQUAL;
    }
}
