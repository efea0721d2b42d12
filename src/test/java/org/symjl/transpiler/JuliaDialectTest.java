package org.symjl.transpiler;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.symjl.evaluate.DenseMatrixValue;
import org.symjl.evaluate.ScalarValue;
import org.symjl.evaluate.SparseMatrixValue;
import org.symjl.expr.BinaryOperator;
import org.symjl.expr.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Julia literal and operator spelling.
 */
@DisplayName("Julia Dialect Tests")
class JuliaDialectTest {

    private final JuliaDialect dialect = JuliaDialect.INSTANCE;

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "1.0, 1.0",
            "-2.5, -2.5",
            "0.3, 0.3",
            "1.0E-12, 1.0e-12",
            "6.02214076E23, 6.02214076e23",
            "NaN, NaN",
            "Infinity, Inf",
            "-Infinity, -Inf"
    })
    @DisplayName("Numbers are written in round-trip form")
    void testFormatNumber(double value, String expected) {
        assertEquals(expected, dialect.formatNumber(value));
    }

    @Test
    @DisplayName("Dense column vectors become flat array literals")
    void testColumn() {
        assertEquals("[1.0,2.0,3.5]", dialect.formatConstant(DenseMatrixValue.column(1.0, 2.0, 3.5)));
        assertEquals("Float64[]", dialect.formatConstant(DenseMatrixValue.column()));
    }

    @Test
    @DisplayName("Dense matrices become row-separated literals")
    void testMatrix() {
        DenseMatrixValue matrix = DenseMatrixValue.of(new double[][]{{1.0, 2.0}, {3.0, 4.0}, {5.0, 6.0}});

        assertEquals("[1.0 2.0; 3.0 4.0; 5.0 6.0]", dialect.formatConstant(matrix));
    }

    @Test
    @DisplayName("A 1x1 matrix and a scalar are both plain numbers")
    void testUnitValues() {
        assertEquals("7.0", dialect.formatConstant(new ScalarValue(7.0)));
        assertEquals("7.0", dialect.formatConstant(DenseMatrixValue.of(new double[][]{{7.0}})));
    }

    @Test
    @DisplayName("Sparse matrices use 1-based coordinates in row-major order")
    void testSparse() {
        SparseMatrixValue sparse = new SparseMatrixValue(3, 3,
                new int[]{2, 0, 0}, new int[]{1, 2, 0}, new double[]{4.0, 2.0, 1.0});

        assertEquals("sparse([1,1,3], [1,3,2], [1.0,2.0,4.0], 3, 3)", dialect.formatConstant(sparse));
    }

    @Test
    @DisplayName("A sparse matrix without entries uses typed empty arrays")
    void testEmptySparse() {
        SparseMatrixValue empty = new SparseMatrixValue(2, 4, new int[0], new int[0], new double[0]);

        assertEquals("sparse(Int64[], Int64[], Float64[], 2, 4)", dialect.formatConstant(empty));
    }

    @Test
    @DisplayName("Operators use their elementwise spelling")
    void testOperators() {
        assertEquals(".^", dialect.infixOperator(BinaryOperator.POWER));
        assertEquals("+", dialect.infixOperator(BinaryOperator.ADD));
        assertEquals("*", dialect.infixOperator(BinaryOperator.INNER));
        assertEquals("<=", dialect.infixOperator(BinaryOperator.LESS_EQUAL));
        assertEquals("-", dialect.prefixOperator(UnaryOperator.NEGATE));
        assertEquals("min", dialect.reductionFunction(BinaryOperator.MINIMUM));
        assertEquals("max", dialect.reductionFunction(BinaryOperator.MAXIMUM));
        assertEquals("@", dialect.matrixProductMarker());
        assertThrows(IllegalArgumentException.class, () -> dialect.infixOperator(BinaryOperator.MATRIX_MULTIPLY));
        assertThrows(IllegalArgumentException.class, () -> dialect.reductionFunction(BinaryOperator.ADD));
    }

    @Test
    @DisplayName("Indexing is 1-based and inclusive")
    void testIndexing() {
        assertEquals("x[3:5]", dialect.slice("x", 3, 5));
        assertEquals("@view y[1:4]", dialect.view("y", 1, 4));
        assertEquals("dy[2]", dialect.element("dy", 2));
        assertEquals("t", dialect.timeSymbol());
        assertEquals("Julia", dialect.name());
    }
}
