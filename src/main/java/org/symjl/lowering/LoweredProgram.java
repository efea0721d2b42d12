package org.symjl.lowering;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.primitive.IntIntMaps;
import org.eclipse.collections.api.factory.primitive.IntLists;
import org.eclipse.collections.api.factory.primitive.IntObjectMaps;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.primitive.MutableIntIntMap;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.symjl.evaluate.ConstantValue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * The three tables produced by lowering one DAG root.
 * 
 * - Constant table: compile-time values, in discovery order
 * - Variable table: one instruction per run-time node, in a valid
 *   topological order, held as a FIFO queue
 * - Size table: the extent of every lowered node
 * 
 * Every lowered identity is in exactly one of the constant and variable
 * tables. The variable queue can be consumed exactly once.
 */
public final class LoweredProgram {

    private final int rootId;
    private final MutableList<LoweredConstant> constants = Lists.mutable.empty();
    private final MutableIntObjectMap<LoweredConstant> constantsById = IntObjectMaps.mutable.empty();
    private final MutableIntObjectMap<PendingInstruction> instructionsById = IntObjectMaps.mutable.empty();
    private final Deque<PendingInstruction> queue = new ArrayDeque<>();
    private final MutableIntList variableOrder = IntLists.mutable.empty();
    private final MutableIntIntMap sizes = IntIntMaps.mutable.empty();
    private boolean consumed;

    LoweredProgram(int rootId) {
        this.rootId = rootId;
    }

    void addConstant(int nodeId, ConstantValue value, int size) {
        requireNew(nodeId);
        LoweredConstant constant = new LoweredConstant(nodeId, value);
        constants.add(constant);
        constantsById.put(nodeId, constant);
        sizes.put(nodeId, size);
    }

    void addInstruction(int nodeId, Instruction instruction, int size) {
        requireNew(nodeId);
        PendingInstruction pending = new PendingInstruction(nodeId, size, instruction);
        queue.addLast(pending);
        instructionsById.put(nodeId, pending);
        variableOrder.add(nodeId);
        sizes.put(nodeId, size);
    }

    private void requireNew(int nodeId) {
        if (isLowered(nodeId)) {
            throw new IllegalStateException("Node " + nodeId + " has already been lowered");
        }
    }

    public int rootId() {
        return rootId;
    }

    public boolean isLowered(int nodeId) {
        return constantsById.containsKey(nodeId) || instructionsById.containsKey(nodeId);
    }

    public boolean isConstant(int nodeId) {
        return constantsById.containsKey(nodeId);
    }

    public boolean isRootConstant() {
        return isConstant(rootId);
    }

    /**
     * @return The constant table in discovery order
     */
    public ListIterable<LoweredConstant> constants() {
        return constants.asUnmodifiable();
    }

    public Optional<LoweredConstant> constant(int nodeId) {
        return Optional.ofNullable(constantsById.get(nodeId));
    }

    /**
     * @return The instruction lowered for a variable node, as it currently
     *         stands
     */
    public Optional<Instruction> instruction(int nodeId) {
        PendingInstruction pending = instructionsById.get(nodeId);
        return pending == null ? Optional.empty() : Optional.of(pending.instruction());
    }

    /**
     * @return Identities of the variable table in insertion order
     */
    public IntList variableOrder() {
        return variableOrder.toImmutable();
    }

    public int instructionCount() {
        return variableOrder.size();
    }

    public int constantCount() {
        return constants.size();
    }

    /**
     * @return The size of a lowered node: 1 for scalars, otherwise its first
     *         dimension
     */
    public int sizeOf(int nodeId) {
        if (!sizes.containsKey(nodeId)) {
            throw new IllegalArgumentException("Node " + nodeId + " has not been lowered");
        }
        return sizes.get(nodeId);
    }

    public boolean isConsumed() {
        return consumed;
    }

    /**
     * Hands the variable table over for emission. Entries must be taken from
     * the head of the returned queue; each is processed once.
     * 
     * @throws IllegalStateException if the table was already consumed
     */
    public Deque<PendingInstruction> consume() {
        if (consumed) {
            throw new IllegalStateException("Lowered program for root " + rootId + " has already been emitted");
        }
        consumed = true;
        return queue;
    }
}
