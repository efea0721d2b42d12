package org.symjl.lowering;

import java.util.Objects;

/**
 * An entry of the variable table waiting to be emitted.
 * 
 * The instruction is replaced in place when an earlier entry is inlined
 * into it.
 */
public final class PendingInstruction {

    private final int nodeId;
    private final int size;
    private Instruction instruction;

    PendingInstruction(int nodeId, int size, Instruction instruction) {
        this.nodeId = nodeId;
        this.size = size;
        this.instruction = Objects.requireNonNull(instruction, "Instruction cannot be null");
    }

    public int nodeId() {
        return nodeId;
    }

    public int size() {
        return size;
    }

    public Instruction instruction() {
        return instruction;
    }

    /**
     * Substitutes {@code replacement} for every reference to the buffer of
     * {@code bufferId}.
     * 
     * @return true if this instruction referenced the buffer
     */
    public boolean inline(int bufferId, Operand replacement) {
        if (!instruction.references(bufferId)) {
            return false;
        }
        instruction = instruction.substitute(bufferId, replacement);
        return true;
    }

    @Override
    public String toString() {
        return BufferNames.longName(nodeId, BufferKind.CACHE) + " = " + instruction;
    }
}
