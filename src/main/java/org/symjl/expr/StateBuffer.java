package org.symjl.expr;

/**
 * The run-time buffer a {@link StateVectorReference} reads from.
 */
public enum StateBuffer {
    /** The primary state vector {@code y}. */
    STATE("y"),
    /** The time derivative of the state vector {@code dy}. */
    DERIVATIVE("dy");

    private final String symbol;

    StateBuffer(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
