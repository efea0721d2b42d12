package org.symjl.transpiler;

import java.util.Objects;

/**
 * The result of a compilation.
 *
 * @param source           The generated Julia text, a {@code begin ... end}
 *                         block
 * @param callableName     The name bound to the callable procedure
 * @param definedName      The name of the {@code function} definition; it
 *                         differs from the callable name when buffers are
 *                         captured in a {@code let} closure
 * @param mode             The solver signature
 * @param capturedBuffers  Whether the procedure closes over a persistent
 *                         constant and cache tuple
 * @param constantCount    Entries {@code const_i} in the preamble
 * @param cacheCount       Surviving buffers {@code cache_i}
 */
public record CompiledProcedure(
        String source,
        String callableName,
        String definedName,
        SolverMode mode,
        boolean capturedBuffers,
        int constantCount,
        int cacheCount) {

    public CompiledProcedure {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(callableName, "Callable name cannot be null");
        Objects.requireNonNull(definedName, "Defined name cannot be null");
        Objects.requireNonNull(mode, "Mode cannot be null");
    }

    @Override
    public String toString() {
        return source;
    }
}
