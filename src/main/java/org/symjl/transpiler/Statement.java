package org.symjl.transpiler;

import org.symjl.lowering.Instruction;
import org.symjl.lowering.Operand;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Sealed interface for the statements of a generated procedure body.
 * 
 * Targets are buffers of lowered nodes; their final names are decided only
 * after every statement is known, since inlining decides which buffers
 * survive.
 */
public sealed interface Statement
        permits Statement.Broadcast, Statement.SliceAssignment, Statement.Temporary,
        Statement.VerticalConcatenation, Statement.MultiplyInPlace, Statement.MatrixProductAssignment,
        Statement.ReductionAssignment {

    /**
     * @return The buffer written by this statement, or null for a temporary
     */
    Operand.BufferRef target();

    /**
     * Applies {@code action} to every buffer this statement writes or reads.
     */
    void forEachBuffer(Consumer<Operand.BufferRef> action);

    /**
     * Elementwise assignment {@code @. target = value}.
     */
    record Broadcast(Operand.BufferRef target, Operand value) implements Statement {

        public Broadcast {
            Objects.requireNonNull(target, "Target cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            action.accept(target);
            value.forEachBuffer(action);
        }
    }

    /**
     * Elementwise assignment into rows {@code first..last} (1-based,
     * inclusive) of the target.
     */
    record SliceAssignment(Operand.BufferRef target, int first, int last, Operand value) implements Statement {

        public SliceAssignment {
            Objects.requireNonNull(target, "Target cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            action.accept(target);
            value.forEachBuffer(action);
        }
    }

    /**
     * A local holding one block of a concatenation built without
     * preallocation.
     */
    record Temporary(String name, Operand value) implements Statement {

        public Temporary {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }

        @Override
        public Operand.BufferRef target() {
            return null;
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            value.forEachBuffer(action);
        }
    }

    record VerticalConcatenation(Operand.BufferRef target, List<String> temporaries) implements Statement {

        public VerticalConcatenation {
            Objects.requireNonNull(target, "Target cannot be null");
            temporaries = List.copyOf(temporaries);
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            action.accept(target);
        }
    }

    /**
     * Matrix product written into the existing target buffer.
     */
    record MultiplyInPlace(Operand.BufferRef target, Instruction.MatrixProduct product) implements Statement {

        public MultiplyInPlace {
            Objects.requireNonNull(target, "Target cannot be null");
            Objects.requireNonNull(product, "Product cannot be null");
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            action.accept(target);
            product.operands().forEach(operand -> operand.forEachBuffer(action));
        }
    }

    /**
     * Matrix product allocating a fresh result.
     */
    record MatrixProductAssignment(Operand.BufferRef target, Instruction.MatrixProduct product) implements Statement {

        public MatrixProductAssignment {
            Objects.requireNonNull(target, "Target cannot be null");
            Objects.requireNonNull(product, "Product cannot be null");
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            action.accept(target);
            product.operands().forEach(operand -> operand.forEachBuffer(action));
        }
    }

    record ReductionAssignment(Operand.BufferRef target, Instruction.Reduction reduction) implements Statement {

        public ReductionAssignment {
            Objects.requireNonNull(target, "Target cannot be null");
            Objects.requireNonNull(reduction, "Reduction cannot be null");
        }

        @Override
        public void forEachBuffer(Consumer<Operand.BufferRef> action) {
            action.accept(target);
            reduction.operands().forEach(operand -> operand.forEachBuffer(action));
        }
    }
}
