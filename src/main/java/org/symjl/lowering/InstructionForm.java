package org.symjl.lowering;

/**
 * The syntactic form of a lowered instruction, which drives emission and
 * inlining decisions.
 */
public enum InstructionForm {
    VIEW(true),
    SLICE(true),
    ADD(true),
    SUBTRACT(true),
    MULTIPLY(true),
    DIVIDE(true),
    NEGATE(true),
    TIME(true),
    POWER(false),
    COMPARISON(false),
    OTHER_BINARY(false),
    OTHER_UNARY(false),
    CALL(false),
    REDUCTION(false),
    MATRIX_PRODUCT(false),
    CONCATENATION(false),
    INPUT_PARAMETER(false);

    private final boolean inlineable;

    InstructionForm(boolean inlineable) {
        this.inlineable = inlineable;
    }

    /**
     * @return true if an instruction of this form is cheap enough to be
     *         substituted into its consumers instead of being materialized
     */
    public boolean inlineable() {
        return inlineable;
    }

    /**
     * @return true if consumers of this form need their operands in
     *         materialized buffers (they cannot be fused into a broadcast)
     */
    public boolean blocksInlining() {
        return this == MATRIX_PRODUCT || this == REDUCTION;
    }
}
