package org.symjl.evaluate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounds constant values to a fixed number of decimals so generated code is
 * identical across floating-point platforms.
 * 
 * Rounding operates on the shortest decimal representation of each double,
 * which makes it idempotent: a value already rounded to the precision comes
 * back unchanged.
 */
public final class ConstantRounding {

    public static final int DEFAULT_DECIMALS = 11;

    private ConstantRounding() {
    }

    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double rounded = new BigDecimal(Double.toString(value))
                .setScale(decimals, RoundingMode.HALF_EVEN)
                .doubleValue();
        // keep -0.0 from leaking into literals
        return rounded == 0.0 ? 0.0 : rounded;
    }

    public static ConstantValue round(ConstantValue value, int decimals) {
        if (value instanceof ScalarValue scalar) {
            return new ScalarValue(round(scalar.value(), decimals));
        }
        if (value instanceof DenseMatrixValue dense) {
            return new DenseMatrixValue(dense.rows(), dense.columns(), round(dense.data(), decimals));
        }
        return round((SparseMatrixValue) value, decimals);
    }

    /**
     * Rounds the stored entries of a sparse matrix. Entries that round to
     * zero are dropped from the sparsity pattern.
     */
    private static SparseMatrixValue round(SparseMatrixValue sparse, int decimals) {
        double[] rounded = round(sparse.values(), decimals);
        int[] sourceRows = sparse.rowIndices();
        int[] sourceColumns = sparse.columnIndices();
        int kept = 0;
        for (double v : rounded) {
            if (v != 0.0) {
                kept++;
            }
        }
        int[] rows = new int[kept];
        int[] columns = new int[kept];
        double[] values = new double[kept];
        int next = 0;
        for (int i = 0; i < rounded.length; i++) {
            if (rounded[i] != 0.0) {
                rows[next] = sourceRows[i];
                columns[next] = sourceColumns[i];
                values[next] = rounded[i];
                next++;
            }
        }
        return new SparseMatrixValue(sparse.rows(), sparse.columns(), rows, columns, values);
    }

    private static double[] round(double[] values, int decimals) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = round(values[i], decimals);
        }
        return result;
    }
}
