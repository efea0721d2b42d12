package org.symjl.transpiler;

import org.symjl.lowering.Instruction;
import org.symjl.lowering.Operand;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders lowered instructions as dialect text.
 * <p>
 * Buffer names are supplied by a {@link NameResolver}.
 */
public final class InstructionPrinter {

    /**
     * Maps a buffer reference to the name it has in the generated text.
     */
    @FunctionalInterface
    public interface NameResolver {
        String resolve(Operand.BufferRef buffer);
    }

    private final ScriptDialect dialect;
    private final NameResolver names;

    public InstructionPrinter(ScriptDialect dialect, NameResolver names) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.names = Objects.requireNonNull(names, "Name resolver cannot be null");
    }

    public String print(Instruction instruction) {
        if (instruction instanceof Instruction.Infix infix) {
            return printOperatorArgument(infix.left()) + " " + dialect.infixOperator(infix.operator()) + " "
                    + printOperatorArgument(infix.right());
        }
        if (instruction instanceof Instruction.MatrixProduct product) {
            return print(product.left()) + " " + dialect.matrixProductMarker() + " " + print(product.right());
        }
        if (instruction instanceof Instruction.Reduction reduction) {
            return dialect.call(dialect.reductionFunction(reduction.operator()),
                    reduction.operands().stream().map(this::print).toList());
        }
        if (instruction instanceof Instruction.Call call) {
            return dialect.call(call.function(), call.arguments().stream().map(this::print).toList());
        }
        if (instruction instanceof Instruction.Prefix prefix) {
            return dialect.prefixOperator(prefix.operator()) + printOperatorArgument(prefix.operand());
        }
        if (instruction instanceof Instruction.Index index) {
            return dialect.slice(print(index.source()), index.first(), index.last());
        }
        if (instruction instanceof Instruction.StateView view) {
            String buffer = view.buffer().symbol();
            return view.isSingleEntry()
                    ? dialect.element(buffer, view.first())
                    : dialect.view(buffer, view.first(), view.last());
        }
        if (instruction instanceof Instruction.Time) {
            return dialect.timeSymbol();
        }
        if (instruction instanceof Instruction.InputParameter parameter) {
            return parameter.name();
        }
        Instruction.Concatenate concatenate = (Instruction.Concatenate) instruction;
        return concatenate.parts().stream()
                .map(part -> part.size() + "::" + print(part.value()))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    public String print(Operand operand) {
        if (operand instanceof Operand.NumberLiteral literal) {
            return dialect.formatNumber(literal.value());
        }
        if (operand instanceof Operand.BufferRef buffer) {
            return names.resolve(buffer);
        }
        if (operand instanceof Operand.Inlined inlined) {
            String text = print(inlined.instruction());
            // parentheses keep the precedence of the substituted expression
            return inlined.instruction().isAtomic() ? text : "(" + text + ")";
        }
        Operand.View view = (Operand.View) operand;
        return dialect.view(print(view.source()), view.first(), view.last());
    }

    /**
     * Prints an operand of an infix or prefix operator. A negative literal is
     * parenthesized, since unary minus binds looser than {@code ^}.
     */
    private String printOperatorArgument(Operand operand) {
        String text = print(operand);
        if (operand instanceof Operand.NumberLiteral literal
                && Double.doubleToRawLongBits(literal.value()) < 0 && !Double.isNaN(literal.value())) {
            return "(" + text + ")";
        }
        return text;
    }

    /**
     * Prints an operand standing alone on the right-hand side of a
     * statement, where no parentheses are needed.
     */
    public String printStatementValue(Operand operand) {
        return operand instanceof Operand.Inlined inlined ? print(inlined.instruction()) : print(operand);
    }
}
