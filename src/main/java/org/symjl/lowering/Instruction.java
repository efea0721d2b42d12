package org.symjl.lowering;

import org.symjl.expr.BinaryOperator;
import org.symjl.expr.StateBuffer;
import org.symjl.expr.UnaryOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sealed interface for the dialect-neutral instruction computing one
 * variable node from the buffers of its children.
 * 
 * Instructions are immutable; inlining produces new instructions through
 * {@link #substitute}.
 */
public sealed interface Instruction
        permits Instruction.Infix, Instruction.MatrixProduct, Instruction.Reduction, Instruction.Call,
        Instruction.Prefix, Instruction.Index, Instruction.StateView, Instruction.Time,
        Instruction.InputParameter, Instruction.Concatenate {

    InstructionForm form();

    List<Operand> operands();

    /**
     * @return A copy of this instruction with the given operands, in the
     *         order returned by {@link #operands()}
     */
    Instruction withOperands(List<Operand> operands);

    default boolean references(int nodeId) {
        return operands().stream().anyMatch(operand -> operand.references(nodeId));
    }

    /**
     * @return true if any operand, at any depth, has the given form
     */
    default boolean contains(InstructionForm form) {
        return operands().stream().anyMatch(operand -> operand.contains(form));
    }

    default Instruction substitute(int nodeId, Operand replacement) {
        if (!references(nodeId)) {
            return this;
        }
        return withOperands(operands().stream()
                .map(operand -> operand.substitute(nodeId, replacement))
                .toList());
    }

    /**
     * @return true if the rendered text of this instruction needs no
     *         parentheses when substituted into another expression
     */
    default boolean isAtomic() {
        return false;
    }

    /**
     * Elementwise infix operation such as {@code a + b} or {@code a .^ b}.
     */
    record Infix(BinaryOperator operator, Operand left, Operand right) implements Instruction {

        public Infix {
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
            if (operator == BinaryOperator.MATRIX_MULTIPLY
                    || operator == BinaryOperator.MINIMUM || operator == BinaryOperator.MAXIMUM) {
                throw new IllegalArgumentException(operator + " is not an elementwise infix operator");
            }
        }

        @Override
        public InstructionForm form() {
            return switch (operator) {
                case ADD -> InstructionForm.ADD;
                case SUBTRACT -> InstructionForm.SUBTRACT;
                case MULTIPLY, INNER -> InstructionForm.MULTIPLY;
                case DIVIDE -> InstructionForm.DIVIDE;
                case POWER -> InstructionForm.POWER;
                case EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> InstructionForm.COMPARISON;
                default -> InstructionForm.OTHER_BINARY;
            };
        }

        @Override
        public List<Operand> operands() {
            return List.of(left, right);
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return new Infix(operator, operands.get(0), operands.get(1));
        }

        @Override
        public String toString() {
            return left + " " + operator.symbol() + " " + right;
        }
    }

    /**
     * Matrix product, kept distinct from elementwise multiplication.
     */
    record MatrixProduct(Operand left, Operand right) implements Instruction {

        public MatrixProduct {
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.MATRIX_PRODUCT;
        }

        @Override
        public List<Operand> operands() {
            return List.of(left, right);
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return new MatrixProduct(operands.get(0), operands.get(1));
        }

        @Override
        public String toString() {
            return left + " @ " + right;
        }
    }

    /**
     * Minimum or maximum of two operands, written as a named call.
     */
    record Reduction(BinaryOperator operator, Operand left, Operand right) implements Instruction {

        public Reduction {
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
            if (operator != BinaryOperator.MINIMUM && operator != BinaryOperator.MAXIMUM) {
                throw new IllegalArgumentException(operator + " is not a reduction");
            }
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.REDUCTION;
        }

        @Override
        public List<Operand> operands() {
            return List.of(left, right);
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return new Reduction(operator, operands.get(0), operands.get(1));
        }

        @Override
        public String toString() {
            return operator.symbol() + "(" + left + ", " + right + ")";
        }
    }

    record Call(String function, List<Operand> arguments) implements Instruction {

        public Call {
            Objects.requireNonNull(function, "Function name cannot be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.CALL;
        }

        @Override
        public List<Operand> operands() {
            return arguments;
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return new Call(function, operands);
        }

        @Override
        public String toString() {
            return function + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
        }
    }

    record Prefix(UnaryOperator operator, Operand operand) implements Instruction {

        public Prefix {
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(operand, "Operand cannot be null");
        }

        @Override
        public InstructionForm form() {
            return operator == UnaryOperator.NEGATE ? InstructionForm.NEGATE : InstructionForm.OTHER_UNARY;
        }

        @Override
        public List<Operand> operands() {
            return List.of(operand);
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return new Prefix(operator, operands.get(0));
        }

        @Override
        public String toString() {
            return operator.symbol() + operand;
        }
    }

    /**
     * Copies rows {@code first..last} (1-based, inclusive) of its source.
     */
    record Index(Operand source, int first, int last) implements Instruction {

        public Index {
            Objects.requireNonNull(source, "Source cannot be null");
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.SLICE;
        }

        @Override
        public List<Operand> operands() {
            return List.of(source);
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return new Index(operands.get(0), first, last);
        }

        @Override
        public String toString() {
            return source + "[" + first + ":" + last + "]";
        }
    }

    /**
     * Reads entries {@code first..last} (1-based, inclusive) of the state or
     * derivative buffer.
     */
    record StateView(StateBuffer buffer, int first, int last) implements Instruction {

        public StateView {
            Objects.requireNonNull(buffer, "Buffer cannot be null");
            if (first < 1 || last < first) {
                throw new IllegalArgumentException("Invalid state window " + first + ":" + last);
            }
        }

        public boolean isSingleEntry() {
            return first == last;
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.VIEW;
        }

        @Override
        public List<Operand> operands() {
            return List.of();
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return this;
        }

        @Override
        public boolean isAtomic() {
            return isSingleEntry();
        }

        @Override
        public String toString() {
            return isSingleEntry()
                    ? buffer.symbol() + "[" + first + "]"
                    : "@view " + buffer.symbol() + "[" + first + ":" + last + "]";
        }
    }

    record Time() implements Instruction {

        @Override
        public InstructionForm form() {
            return InstructionForm.TIME;
        }

        @Override
        public List<Operand> operands() {
            return List.of();
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return this;
        }

        @Override
        public boolean isAtomic() {
            return true;
        }

        @Override
        public String toString() {
            return "t";
        }
    }

    /**
     * Placeholder for a caller-supplied parameter, resolved at emission.
     */
    record InputParameter(String name) implements Instruction {

        public InputParameter {
            Objects.requireNonNull(name, "Parameter name cannot be null");
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.INPUT_PARAMETER;
        }

        @Override
        public List<Operand> operands() {
            return List.of();
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            return this;
        }

        @Override
        public String toString() {
            return "inputs['" + name + "']";
        }
    }

    /**
     * Ordered list of blocks forming a column vector. Emission assigns each
     * block to its own range of the destination.
     */
    record Concatenate(List<ConcatenationPart> parts) implements Instruction {

        public Concatenate {
            parts = List.copyOf(parts);
        }

        public int size() {
            return parts.stream().mapToInt(ConcatenationPart::size).sum();
        }

        @Override
        public InstructionForm form() {
            return InstructionForm.CONCATENATION;
        }

        @Override
        public List<Operand> operands() {
            return parts.stream().map(ConcatenationPart::value).toList();
        }

        @Override
        public Instruction withOperands(List<Operand> operands) {
            List<ConcatenationPart> replaced = new ArrayList<>(parts.size());
            for (int i = 0; i < parts.size(); i++) {
                replaced.add(new ConcatenationPart(parts.get(i).size(), operands.get(i)));
            }
            return new Concatenate(replaced);
        }

        @Override
        public String toString() {
            return parts.stream().map(part -> part.size() + "::" + part.value())
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }
}
