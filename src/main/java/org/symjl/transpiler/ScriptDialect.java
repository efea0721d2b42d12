package org.symjl.transpiler;

import org.symjl.evaluate.ConstantValue;
import org.symjl.evaluate.DenseMatrixValue;
import org.symjl.evaluate.ScalarValue;
import org.symjl.evaluate.SparseMatrixValue;
import org.symjl.expr.BinaryOperator;
import org.symjl.expr.UnaryOperator;

import java.util.List;

/**
 * Interface defining the expression syntax of a target scripting dialect.
 * Implementations handle literal formatting, operator spelling and
 * indexing conventions.
 */
public interface ScriptDialect {

    /**
     * @return The dialect name (e.g., "Julia")
     */
    String name();

    /**
     * Format a scalar literal with enough digits to round-trip.
     */
    String formatNumber(double value);

    /**
     * Format a dense column vector as a flat array literal.
     */
    String formatColumn(double[] values);

    /**
     * Format a dense matrix literal.
     */
    String formatMatrix(DenseMatrixValue matrix);

    /**
     * Format a sparse matrix constructor with indices converted to the
     * dialect's index base.
     */
    String formatSparse(SparseMatrixValue matrix);

    /**
     * The elementwise spelling of an infix operator.
     */
    String infixOperator(BinaryOperator operator);

    String prefixOperator(UnaryOperator operator);

    /**
     * The function name used for a min/max reduction.
     */
    String reductionFunction(BinaryOperator operator);

    /**
     * The marker distinguishing a matrix product from elementwise
     * multiplication.
     */
    String matrixProductMarker();

    /**
     * A copying slice {@code source[first:last]} (1-based, inclusive).
     */
    String slice(String source, int first, int last);

    /**
     * A non-copying view of {@code source[first:last]} (1-based, inclusive).
     */
    String view(String source, int first, int last);

    /**
     * A single element {@code source[index]} (1-based).
     */
    String element(String source, int index);

    String call(String function, List<String> arguments);

    String timeSymbol();

    /**
     * Format any constant value. 1x1 dense values become plain numbers.
     */
    default String formatConstant(ConstantValue value) {
        if (value instanceof ScalarValue scalar) {
            return formatNumber(scalar.value());
        }
        if (value instanceof SparseMatrixValue sparse) {
            return formatSparse(sparse);
        }
        DenseMatrixValue dense = (DenseMatrixValue) value;
        if (dense.rows() == 1 && dense.columns() == 1) {
            return formatNumber(dense.get(0, 0));
        }
        return dense.isColumn() ? formatColumn(dense.data()) : formatMatrix(dense);
    }
}
