package org.symjl.transpiler;

import org.symjl.evaluate.DenseMatrixValue;
import org.symjl.evaluate.SparseMatrixValue;
import org.symjl.expr.BinaryOperator;
import org.symjl.expr.UnaryOperator;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Dialect implementation for Julia.
 * Julia indexes from 1, includes both ends of a range and broadcasts with
 * dotted operators.
 */
public final class JuliaDialect implements ScriptDialect {

    public static final JuliaDialect INSTANCE = new JuliaDialect();

    private JuliaDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "Julia";
    }

    @Override
    public String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Inf" : "-Inf";
        }
        // Double.toString is the shortest round-tripping form; Julia wants a lower-case exponent
        return Double.toString(value).replace('E', 'e');
    }

    @Override
    public String formatColumn(double[] values) {
        if (values.length == 0) {
            return "Float64[]";
        }
        return Arrays.stream(values).mapToObj(this::formatNumber).collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public String formatMatrix(DenseMatrixValue matrix) {
        if (matrix.rows() == 0) {
            return "zeros(0, " + matrix.columns() + ")";
        }
        return IntStream.range(0, matrix.rows())
                .mapToObj(r -> IntStream.range(0, matrix.columns())
                        .mapToObj(c -> formatNumber(matrix.get(r, c)))
                        .collect(Collectors.joining(" ")))
                .collect(Collectors.joining("; ", "[", "]"));
    }

    @Override
    public String formatSparse(SparseMatrixValue matrix) {
        String rows;
        String columns;
        String values;
        if (matrix.entryCount() == 0) {
            rows = "Int64[]";
            columns = "Int64[]";
            values = "Float64[]";
        } else {
            // add 1 to correct for 1-indexing
            rows = Arrays.stream(matrix.rowIndices()).mapToObj(i -> Integer.toString(i + 1))
                    .collect(Collectors.joining(",", "[", "]"));
            columns = Arrays.stream(matrix.columnIndices()).mapToObj(i -> Integer.toString(i + 1))
                    .collect(Collectors.joining(",", "[", "]"));
            values = formatColumn(matrix.values());
        }
        return "sparse(" + rows + ", " + columns + ", " + values + ", " + matrix.rows() + ", " + matrix.columns() + ")";
    }

    @Override
    public String infixOperator(BinaryOperator operator) {
        return switch (operator) {
            case POWER -> ".^";
            case INNER -> "*";
            case MATRIX_MULTIPLY, MINIMUM, MAXIMUM ->
                    throw new IllegalArgumentException(operator + " has no infix form");
            default -> operator.symbol();
        };
    }

    @Override
    public String prefixOperator(UnaryOperator operator) {
        return operator.symbol();
    }

    @Override
    public String reductionFunction(BinaryOperator operator) {
        return switch (operator) {
            case MINIMUM -> "min";
            case MAXIMUM -> "max";
            default -> throw new IllegalArgumentException(operator + " is not a reduction");
        };
    }

    @Override
    public String matrixProductMarker() {
        return "@";
    }

    @Override
    public String slice(String source, int first, int last) {
        return source + "[" + first + ":" + last + "]";
    }

    @Override
    public String view(String source, int first, int last) {
        return "@view " + source + "[" + first + ":" + last + "]";
    }

    @Override
    public String element(String source, int index) {
        return source + "[" + index + "]";
    }

    @Override
    public String call(String function, List<String> arguments) {
        return function + "(" + String.join(", ", arguments) + ")";
    }

    @Override
    public String timeSymbol() {
        return "t";
    }
}
