package org.symjl.transpiler;

/**
 * The kind of solver the generated procedure is written for.
 */
public enum SolverMode {
    /** Explicit ODE: the result is the state derivative. */
    ODE("dy", "dy, y, p, t"),
    /** Implicit DAE: the result is a residual that must vanish. */
    DAE("out", "out, dy, y, p, t");

    private final String output;
    private final String parameters;

    SolverMode(String output, String parameters) {
        this.output = output;
        this.parameters = parameters;
    }

    /**
     * @return The name of the caller-supplied buffer receiving the result
     */
    public String output() {
        return output;
    }

    /**
     * @return The parameter list of the generated procedure
     */
    public String parameters() {
        return parameters;
    }
}
