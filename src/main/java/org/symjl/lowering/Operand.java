package org.symjl.lowering;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Sealed interface for the operands of lowered instructions.
 * 
 * Includes:
 * - NumberLiteral: a scalar constant written in place
 * - BufferRef: the buffer holding another node's value
 * - Inlined: another node's instruction substituted in place of its buffer
 * - View: a 1-based inclusive window over another operand
 */
public sealed interface Operand permits Operand.NumberLiteral, Operand.BufferRef, Operand.Inlined, Operand.View {

    /**
     * @return true if this operand reads the buffer of {@code nodeId}
     */
    boolean references(int nodeId);

    /**
     * @return true if this operand, or anything inlined into it, has the
     *         given form
     */
    boolean contains(InstructionForm form);

    /**
     * Replaces every reference to the buffer of {@code nodeId}.
     */
    Operand substitute(int nodeId, Operand replacement);

    /**
     * Applies {@code action} to every buffer this operand reads, at any depth.
     */
    void forEachBuffer(Consumer<BufferRef> action);

    record NumberLiteral(double value) implements Operand {

        @Override
        public boolean references(int nodeId) {
            return false;
        }

        @Override
        public boolean contains(InstructionForm form) {
            return false;
        }

        @Override
        public Operand substitute(int nodeId, Operand replacement) {
            return this;
        }

        @Override
        public void forEachBuffer(Consumer<BufferRef> action) {
        }
    }

    record BufferRef(int nodeId, BufferKind kind) implements Operand {

        public BufferRef {
            Objects.requireNonNull(kind, "Kind cannot be null");
        }

        public static BufferRef cache(int nodeId) {
            return new BufferRef(nodeId, BufferKind.CACHE);
        }

        public static BufferRef constant(int nodeId) {
            return new BufferRef(nodeId, BufferKind.CONST);
        }

        @Override
        public boolean references(int id) {
            return nodeId == id;
        }

        @Override
        public boolean contains(InstructionForm form) {
            return false;
        }

        @Override
        public Operand substitute(int id, Operand replacement) {
            return nodeId == id ? replacement : this;
        }

        @Override
        public void forEachBuffer(Consumer<BufferRef> action) {
            action.accept(this);
        }

        @Override
        public String toString() {
            return BufferNames.longName(nodeId, kind);
        }
    }

    record Inlined(Instruction instruction) implements Operand {

        public Inlined {
            Objects.requireNonNull(instruction, "Instruction cannot be null");
        }

        @Override
        public boolean references(int nodeId) {
            return instruction.references(nodeId);
        }

        @Override
        public boolean contains(InstructionForm form) {
            return instruction.form() == form || instruction.contains(form);
        }

        @Override
        public Operand substitute(int nodeId, Operand replacement) {
            return new Inlined(instruction.substitute(nodeId, replacement));
        }

        @Override
        public void forEachBuffer(Consumer<BufferRef> action) {
            instruction.operands().forEach(operand -> operand.forEachBuffer(action));
        }

        @Override
        public String toString() {
            return "(" + instruction + ")";
        }
    }

    record View(Operand source, int first, int last) implements Operand {

        public View {
            Objects.requireNonNull(source, "Source cannot be null");
            if (first < 1 || last < first - 1) {
                throw new IllegalArgumentException("Invalid 1-based window " + first + ":" + last);
            }
        }

        @Override
        public boolean references(int nodeId) {
            return source.references(nodeId);
        }

        @Override
        public boolean contains(InstructionForm form) {
            return source.contains(form);
        }

        @Override
        public Operand substitute(int nodeId, Operand replacement) {
            return new View(source.substitute(nodeId, replacement), first, last);
        }

        @Override
        public void forEachBuffer(Consumer<BufferRef> action) {
            source.forEachBuffer(action);
        }

        @Override
        public String toString() {
            return "@view " + source + "[" + first + ":" + last + "]";
        }
    }
}
