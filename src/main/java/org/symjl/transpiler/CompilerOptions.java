package org.symjl.transpiler;

import org.symjl.evaluate.ConstantRounding;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Settings of a single compilation.
 *
 * @param functionName        Base name of the generated procedure; the
 *                            callable is {@code functionName + "!"}
 * @param inputParameterOrder Names of the input parameters in the order they
 *                            are unpacked from {@code p}
 * @param differentialCount   Number of differential equations at the front
 *                            of the root, or null for an explicit ODE
 * @param preallocate         Whether cache buffers are allocated once and
 *                            captured by the procedure
 * @param roundConstants      Whether constant values are rounded
 * @param roundingDecimals    Decimal places kept when rounding
 */
public record CompilerOptions(
        String functionName,
        List<String> inputParameterOrder,
        Integer differentialCount,
        boolean preallocate,
        boolean roundConstants,
        int roundingDecimals) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public CompilerOptions {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        if (!IDENTIFIER.matcher(functionName).matches()) {
            throw new IllegalArgumentException("Invalid function name: '" + functionName + "'");
        }
        inputParameterOrder = List.copyOf(inputParameterOrder);
        for (String name : inputParameterOrder) {
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid input parameter name: '" + name + "'");
            }
        }
        if (new HashSet<>(inputParameterOrder).size() != inputParameterOrder.size()) {
            throw new IllegalArgumentException("Duplicate input parameter names: " + inputParameterOrder);
        }
        if (differentialCount != null && differentialCount < 0) {
            throw new IllegalArgumentException("Differential count cannot be negative: " + differentialCount);
        }
        if (roundingDecimals < 0) {
            throw new IllegalArgumentException("Rounding decimals cannot be negative: " + roundingDecimals);
        }
    }

    /**
     * Function {@code f}, no input parameters, ODE mode, preallocation and
     * rounding on.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions("f", List.of(), null, true, true, ConstantRounding.DEFAULT_DECIMALS);
    }

    public CompilerOptions withFunctionName(String name) {
        return new CompilerOptions(name, inputParameterOrder, differentialCount, preallocate, roundConstants,
                roundingDecimals);
    }

    public CompilerOptions withInputParameterOrder(List<String> order) {
        return new CompilerOptions(functionName, order, differentialCount, preallocate, roundConstants,
                roundingDecimals);
    }

    public CompilerOptions withInputParameterOrder(String... order) {
        return withInputParameterOrder(List.of(order));
    }

    /**
     * Switches to DAE mode with the first {@code count} entries of the root
     * being differential equations.
     */
    public CompilerOptions withDifferentialCount(int count) {
        return new CompilerOptions(functionName, inputParameterOrder, count, preallocate, roundConstants,
                roundingDecimals);
    }

    public CompilerOptions withoutDifferentialCount() {
        return new CompilerOptions(functionName, inputParameterOrder, null, preallocate, roundConstants,
                roundingDecimals);
    }

    public CompilerOptions withPreallocate(boolean value) {
        return new CompilerOptions(functionName, inputParameterOrder, differentialCount, value, roundConstants,
                roundingDecimals);
    }

    public CompilerOptions withRoundConstants(boolean value) {
        return new CompilerOptions(functionName, inputParameterOrder, differentialCount, preallocate, value,
                roundingDecimals);
    }

    public CompilerOptions withRoundingDecimals(int decimals) {
        return new CompilerOptions(functionName, inputParameterOrder, differentialCount, preallocate, roundConstants,
                decimals);
    }

    public SolverMode mode() {
        return differentialCount == null ? SolverMode.ODE : SolverMode.DAE;
    }
}
