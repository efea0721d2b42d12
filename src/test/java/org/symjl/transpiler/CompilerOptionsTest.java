package org.symjl.transpiler;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for compilation settings.
 */
@DisplayName("Compiler Options Tests")
class CompilerOptionsTest {

    @Test
    @DisplayName("Defaults compile an ODE with preallocation and rounding")
    void testDefaults() {
        CompilerOptions options = CompilerOptions.defaults();

        assertEquals("f", options.functionName());
        assertEquals(List.of(), options.inputParameterOrder());
        assertNull(options.differentialCount());
        assertTrue(options.preallocate());
        assertTrue(options.roundConstants());
        assertEquals(11, options.roundingDecimals());
        assertEquals(SolverMode.ODE, options.mode());
    }

    @Test
    @DisplayName("Copy methods change one setting at a time")
    void testCopies() {
        CompilerOptions options = CompilerOptions.defaults()
                .withFunctionName("residual")
                .withInputParameterOrder("a", "b")
                .withDifferentialCount(4)
                .withPreallocate(false)
                .withRoundConstants(false)
                .withRoundingDecimals(6);

        assertEquals("residual", options.functionName());
        assertEquals(List.of("a", "b"), options.inputParameterOrder());
        assertEquals(Integer.valueOf(4), options.differentialCount());
        assertFalse(options.preallocate());
        assertFalse(options.roundConstants());
        assertEquals(6, options.roundingDecimals());
        assertEquals(SolverMode.DAE, options.mode());
        assertEquals(SolverMode.ODE, options.withoutDifferentialCount().mode());
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void testValidation() {
        CompilerOptions defaults = CompilerOptions.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withFunctionName("my function"));
        assertThrows(IllegalArgumentException.class, () -> defaults.withFunctionName("1f"));
        assertThrows(IllegalArgumentException.class, () -> defaults.withInputParameterOrder("a", "a"));
        assertThrows(IllegalArgumentException.class, () -> defaults.withInputParameterOrder("p[1]"));
        assertThrows(IllegalArgumentException.class, () -> defaults.withDifferentialCount(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withRoundingDecimals(-2));
        assertThrows(NullPointerException.class, () -> defaults.withFunctionName(null));
    }

    @Test
    @DisplayName("Solver modes name their output buffer and signature")
    void testSolverModes() {
        assertEquals("dy", SolverMode.ODE.output());
        assertEquals("dy, y, p, t", SolverMode.ODE.parameters());
        assertEquals("out", SolverMode.DAE.output());
        assertEquals("out, dy, y, p, t", SolverMode.DAE.parameters());
    }
}
