package org.symjl.transpiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.factory.primitive.IntObjectMaps;
import org.eclipse.collections.api.factory.primitive.IntSets;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.api.set.primitive.MutableIntSet;
import org.symjl.evaluate.ConstantEvaluator;
import org.symjl.evaluate.ConstantValue;
import org.symjl.evaluate.ScalarValue;
import org.symjl.expr.ExpressionArena;
import org.symjl.expr.ExpressionNode;
import org.symjl.lowering.BufferKind;
import org.symjl.lowering.BufferNames;
import org.symjl.lowering.ConcatenationPart;
import org.symjl.lowering.Instruction;
import org.symjl.lowering.InstructionForm;
import org.symjl.lowering.LoweredProgram;
import org.symjl.lowering.LoweringPass;
import org.symjl.lowering.Operand;
import org.symjl.lowering.PendingInstruction;
import org.symjl.lowering.UnsupportedInputException;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Generates a Julia procedure from an expression DAG.
 *
 * Pipeline:
 * 1. In DAE mode the root is rewritten into a residual
 * 2. {@link LoweringPass} produces the constant table and the instruction
 *    queue
 * 3. The queue is drained in topological order; cheap instructions are
 *    inlined into their consumers, the rest become statements
 * 4. Surviving buffers are named, the preamble is built and the procedure
 *    text is assembled
 *
 * Example output (ODE, preallocated):
 *
 * <pre>
 * begin
 * f! = let cs = (
 *    const_0 = [1.0 2.0; 3.0 4.0],
 *    const_1 = [1.0,2.0],
 *    cache_0 = zeros(2),
 * )
 *
 * function f_with_consts!(dy, y, p, t)
 *    mul!(cs.cache_0, cs.const_0, (@view y[1:2]))
 *    @. dy = cs.cache_0 + cs.const_1
 *    nothing
 * end
 *
 * end
 * end
 * </pre>
 */
public final class JuliaCodeGenerator {

    private static final Logger LOGGER = LogManager.getLogger(JuliaCodeGenerator.class);

    private static final String INDENT = "   ";
    private static final String CAPTURE = "cs";

    private final ExpressionArena arena;
    private final ConstantEvaluator evaluator;
    private final ScriptDialect dialect;

    public JuliaCodeGenerator(ExpressionArena arena, ConstantEvaluator evaluator) {
        this(arena, evaluator, JuliaDialect.INSTANCE);
    }

    public JuliaCodeGenerator(ExpressionArena arena, ConstantEvaluator evaluator, ScriptDialect dialect) {
        this.arena = Objects.requireNonNull(arena, "Arena cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public CompiledProcedure generate(ExpressionNode root) {
        return generate(root, CompilerOptions.defaults());
    }

    /**
     * Compiles a DAG root into a procedure.
     *
     * @param root    The expression to compute
     * @param options Compilation settings
     * @return The generated procedure
     * @throws org.symjl.lowering.UnsupportedNodeKindException if the DAG
     *         contains a node kind with no code generation rule
     * @throws UnsupportedInputException if the DAG or options carry data that
     *         cannot be expressed
     */
    public CompiledProcedure generate(ExpressionNode root, CompilerOptions options) {
        Objects.requireNonNull(root, "Root cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        ExpressionNode target = options.differentialCount() == null
                ? root
                : new ResidualRewriter(arena).rewrite(root, options.differentialCount());
        LoweredProgram program = new LoweringPass(evaluator, options.roundingDecimals())
                .lower(target, options.roundConstants());
        return emit(program, options);
    }

    /**
     * Emits a lowered program. The program's instruction queue is drained,
     * so a program can be emitted only once.
     *
     * @throws IllegalStateException if the program was already emitted
     */
    public CompiledProcedure emit(LoweredProgram program, CompilerOptions options) {
        Objects.requireNonNull(program, "Program cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        return new Emission(program, options).run();
    }

    /**
     * State of a single emission.
     */
    private final class Emission {

        private final LoweredProgram program;
        private final CompilerOptions options;
        private final List<Statement> statements = new ArrayList<>();
        private final MutableIntObjectMap<String> inputParameters = IntObjectMaps.mutable.empty();
        private final MutableIntObjectMap<String> constantNames = IntObjectMaps.mutable.empty();
        private final MutableIntObjectMap<String> cacheNames = IntObjectMaps.mutable.empty();
        private final InstructionPrinter printer;
        private int temporaries;

        private Emission(LoweredProgram program, CompilerOptions options) {
            this.program = program;
            this.options = options;
            this.printer = new InstructionPrinter(dialect, this::resolve);
        }

        CompiledProcedure run() {
            Deque<PendingInstruction> queue = program.consume();
            program.constants().forEachWithIndex((constant, position) ->
                    constantNames.put(constant.nodeId(), BufferNames.shortName(position, BufferKind.CONST)));

            while (!queue.isEmpty()) {
                process(queue.poll(), queue);
            }
            nameSurvivingCaches();
            checkInputParameters();

            List<String> body = new ArrayList<>();
            for (Statement statement : statements) {
                body.add(render(statement));
            }
            if (program.isRootConstant()) {
                body.add(options.mode().output() + " .= " + constantRootValue());
            }

            List<String> preamble = new ArrayList<>();
            program.constants().each(constant -> preamble.add(
                    constantNames.get(constant.nodeId()) + " = " + dialect.formatConstant(constant.value())));
            if (options.preallocate()) {
                program.variableOrder().each(id -> {
                    String name = cacheNames.get(id);
                    if (name != null) {
                        preamble.add(name + " = zeros(" + program.sizeOf(id) + ")");
                    }
                });
            }

            boolean captured = options.preallocate() && !preamble.isEmpty();
            String callableName = options.functionName() + "!";
            String definedName = captured ? options.functionName() + "_with_consts!" : callableName;
            String source = assemble(preamble, body, callableName, definedName, captured);

            LOGGER.debug("Emitted {} with {} statements, {} constants and {} caches",
                    definedName, body.size(), constantNames.size(), cacheNames.size());
            return new CompiledProcedure(source, callableName, definedName, options.mode(), captured,
                    constantNames.size(), cacheNames.size());
        }

        // ==================== Statement selection ====================

        private void process(PendingInstruction pending, Deque<PendingInstruction> remaining) {
            int id = pending.nodeId();
            Instruction instruction = pending.instruction();
            Operand.BufferRef target = Operand.BufferRef.cache(id);

            if (instruction instanceof Instruction.Concatenate concatenate) {
                concatenate(target, concatenate);
            } else if (instruction instanceof Instruction.MatrixProduct product) {
                statements.add(options.preallocate()
                        ? new Statement.MultiplyInPlace(target, product)
                        : new Statement.MatrixProductAssignment(target, product));
            } else if (instruction instanceof Instruction.InputParameter parameter) {
                // read through the unpacked parameter name; nothing to compute
                inputParameters.put(id, parameter.name());
                if (isRoot(target)) {
                    statements.add(new Statement.Broadcast(target, new Operand.Inlined(parameter)));
                }
            } else if (instruction instanceof Instruction.Reduction reduction) {
                statements.add(new Statement.ReductionAssignment(target, reduction));
            } else if (!inline(pending, remaining)) {
                statements.add(new Statement.Broadcast(target, new Operand.Inlined(instruction)));
            }
        }

        private void concatenate(Operand.BufferRef target, Instruction.Concatenate concatenate) {
            if (options.preallocate() || isRoot(target)) {
                int start = 0;
                for (ConcatenationPart part : concatenate.parts()) {
                    int end = start + part.size();
                    statements.add(new Statement.SliceAssignment(target, start + 1, end, part.value()));
                    start = end;
                }
                return;
            }
            List<String> names = new ArrayList<>();
            for (ConcatenationPart part : concatenate.parts()) {
                String name = "x" + (++temporaries);
                statements.add(new Statement.Temporary(name, part.value()));
                names.add(name);
            }
            statements.add(new Statement.VerticalConcatenation(target, names));
        }

        /**
         * Substitutes a cheap instruction into every later instruction that
         * reads its buffer.
         *
         * @return false if the instruction must be materialized instead
         */
        private boolean inline(PendingInstruction pending, Deque<PendingInstruction> remaining) {
            int id = pending.nodeId();
            Instruction instruction = pending.instruction();
            if (!instruction.form().inlineable()) {
                return false;
            }
            if (instruction.form() != InstructionForm.VIEW && hasBlockingConsumer(id, remaining)) {
                LOGGER.trace("Keeping {} in a buffer for a matrix product or reduction", pending);
                return false;
            }
            Operand replacement = new Operand.Inlined(instruction);
            boolean replaced = false;
            for (PendingInstruction next : remaining) {
                replaced |= next.inline(id, replacement);
            }
            if (replaced) {
                LOGGER.trace("Inlined {}", pending);
            }
            return replaced;
        }

        private boolean hasBlockingConsumer(int id, Deque<PendingInstruction> remaining) {
            return remaining.stream()
                    .map(PendingInstruction::instruction)
                    .anyMatch(next -> next.references(id)
                            && (next.form().blocksInlining()
                            || next.contains(InstructionForm.MATRIX_PRODUCT)
                            || next.contains(InstructionForm.REDUCTION)));
        }

        // ==================== Naming ====================

        private boolean isRoot(Operand.BufferRef buffer) {
            return buffer.kind() == BufferKind.CACHE && buffer.nodeId() == program.rootId();
        }

        private void nameSurvivingCaches() {
            MutableIntSet used = IntSets.mutable.empty();
            for (Statement statement : statements) {
                statement.forEachBuffer(buffer -> {
                    if (buffer.kind() == BufferKind.CACHE && !isRoot(buffer)
                            && !inputParameters.containsKey(buffer.nodeId())) {
                        used.add(buffer.nodeId());
                    }
                });
            }
            program.variableOrder().each(id -> {
                if (used.contains(id)) {
                    cacheNames.put(id, BufferNames.shortName(cacheNames.size(), BufferKind.CACHE));
                }
            });
        }

        private void checkInputParameters() {
            for (String name : inputParameters.values()) {
                if (!options.inputParameterOrder().contains(name)) {
                    throw new UnsupportedInputException("input parameter '" + name
                            + "' is not in the input parameter order " + options.inputParameterOrder());
                }
            }
        }

        private String resolve(Operand.BufferRef buffer) {
            int id = buffer.nodeId();
            if (buffer.kind() == BufferKind.CONST) {
                return CAPTURE + "." + requireName(constantNames.get(id), buffer);
            }
            if (id == program.rootId()) {
                return options.mode().output();
            }
            String parameter = inputParameters.get(id);
            if (parameter != null) {
                return parameter;
            }
            String cache = requireName(cacheNames.get(id), buffer);
            return options.preallocate() ? CAPTURE + "." + cache : cache;
        }

        private String requireName(String name, Operand.BufferRef buffer) {
            if (name == null) {
                throw new IllegalStateException("No generated name for buffer " + buffer);
            }
            return name;
        }

        private String constantRootValue() {
            ConstantValue value = program.constant(program.rootId()).orElseThrow().value();
            if (value instanceof ScalarValue scalar) {
                return dialect.formatNumber(scalar.value());
            }
            return CAPTURE + "." + constantNames.get(program.rootId());
        }

        // ==================== Rendering ====================

        private String render(Statement statement) {
            if (statement instanceof Statement.Broadcast broadcast) {
                String target = resolve(broadcast.target());
                String value = printer.printStatementValue(broadcast.value());
                if (isRoot(broadcast.target())) {
                    return program.sizeOf(program.rootId()) == 1
                            ? target + " .= " + value
                            : "@. " + target + " = " + value;
                }
                return options.preallocate() ? "@. " + target + " = " + value : target + " = @. " + value;
            }
            if (statement instanceof Statement.SliceAssignment slice) {
                return "@. " + dialect.slice(resolve(slice.target()), slice.first(), slice.last())
                        + " = " + printer.printStatementValue(slice.value());
            }
            if (statement instanceof Statement.Temporary temporary) {
                return temporary.name() + " = @. " + printer.printStatementValue(temporary.value());
            }
            if (statement instanceof Statement.VerticalConcatenation concatenation) {
                return resolve(concatenation.target()) + " = " + dialect.call("vcat", concatenation.temporaries());
            }
            if (statement instanceof Statement.MultiplyInPlace multiply) {
                Instruction.MatrixProduct product = multiply.product();
                return dialect.call("mul!", List.of(resolve(multiply.target()),
                        printer.print(product.left()), printer.print(product.right())));
            }
            if (statement instanceof Statement.MatrixProductAssignment assignment) {
                Instruction.MatrixProduct product = assignment.product();
                String value = printer.print(product.left()) + " * " + printer.print(product.right());
                return resolve(assignment.target()) + (isRoot(assignment.target()) ? " .= " : " = ") + value;
            }
            Statement.ReductionAssignment reduction = (Statement.ReductionAssignment) statement;
            boolean inPlace = options.preallocate() || isRoot(reduction.target());
            return resolve(reduction.target()) + (inPlace ? " .= " : " = ") + printer.print(reduction.reduction());
        }

        private String assemble(List<String> preamble, List<String> body, String callableName, String definedName,
                                boolean captured) {
            StringBuilder sb = new StringBuilder();
            sb.append("begin\n");
            if (!preamble.isEmpty()) {
                if (captured) {
                    // the tuple is built once and closed over by every call
                    sb.append(callableName).append(" = let ");
                }
                sb.append(CAPTURE).append(" = (\n");
                for (String entry : preamble) {
                    sb.append(INDENT).append(entry).append(",\n");
                }
                sb.append(")\n");
            }

            sb.append("\nfunction ").append(definedName).append("(").append(options.mode().parameters()).append(")\n");
            List<String> order = options.inputParameterOrder();
            if (order.size() == 1) {
                sb.append(INDENT).append(order.get(0)).append(" = p[1]\n");
            } else if (order.size() > 1) {
                sb.append(INDENT).append(String.join(", ", order)).append(" = p\n");
            }
            for (String line : body) {
                sb.append(INDENT).append(line).append("\n");
            }
            // returning nothing avoids allocating a result
            sb.append(INDENT).append("nothing\n");
            sb.append("end\n\n");

            if (captured) {
                sb.append("end\n");
            }
            sb.append("end");
            return sb.toString();
        }
    }
}
