package org.symjl.expr;

/**
 * Elementwise unary operators supported by {@link UnaryOperation}.
 */
public enum UnaryOperator {
    NEGATE("-"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
