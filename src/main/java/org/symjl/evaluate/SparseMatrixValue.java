package org.symjl.evaluate;

import org.symjl.expr.Shape;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * A sparse matrix constant in coordinate form with 0-based indices.
 * 
 * Entries are kept sorted row-major, so two matrices with the same entries
 * compare equal regardless of the order they were supplied in.
 */
public record SparseMatrixValue(
        int rows,
        int columns,
        int[] rowIndices,
        int[] columnIndices,
        double[] values) implements ConstantValue {

    public SparseMatrixValue {
        if (rows < 0 || columns < 1) {
            throw new IllegalArgumentException("Invalid matrix dimensions: " + rows + "x" + columns);
        }
        if (rowIndices.length != values.length || columnIndices.length != values.length) {
            throw new IllegalArgumentException("Row, column and value arrays must have equal length");
        }
        for (int i = 0; i < values.length; i++) {
            if (rowIndices[i] < 0 || rowIndices[i] >= rows || columnIndices[i] < 0 || columnIndices[i] >= columns) {
                throw new IllegalArgumentException("Entry (" + rowIndices[i] + ", " + columnIndices[i]
                        + ") lies outside a " + rows + "x" + columns + " matrix");
            }
        }
        int[] r = rowIndices;
        int[] c = columnIndices;
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.<Integer>comparingInt(i -> r[i]).thenComparingInt(i -> c[i]));
        int[] sortedRows = new int[order.length];
        int[] sortedColumns = new int[order.length];
        double[] sortedValues = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            sortedRows[i] = r[order[i]];
            sortedColumns[i] = c[order[i]];
            sortedValues[i] = values[order[i]];
        }
        rowIndices = sortedRows;
        columnIndices = sortedColumns;
        values = sortedValues;
    }

    /**
     * Builds a sparse matrix from the non-zero entries of a dense one.
     */
    public static SparseMatrixValue fromDense(DenseMatrixValue dense) {
        int count = 0;
        for (double v : dense.data()) {
            if (v != 0.0) {
                count++;
            }
        }
        int[] r = new int[count];
        int[] c = new int[count];
        double[] v = new double[count];
        int k = 0;
        for (int row = 0; row < dense.rows(); row++) {
            for (int column = 0; column < dense.columns(); column++) {
                double value = dense.get(row, column);
                if (value != 0.0) {
                    r[k] = row;
                    c[k] = column;
                    v[k] = value;
                    k++;
                }
            }
        }
        return new SparseMatrixValue(dense.rows(), dense.columns(), r, c, v);
    }

    @Override
    public int[] rowIndices() {
        return rowIndices.clone();
    }

    @Override
    public int[] columnIndices() {
        return columnIndices.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int entryCount() {
        return values.length;
    }

    @Override
    public Shape shape() {
        return Shape.matrix(rows, columns);
    }

    @Override
    public DenseMatrixValue toDense() {
        double[] data = new double[rows * columns];
        for (int i = 0; i < values.length; i++) {
            data[rowIndices[i] * columns + columnIndices[i]] += values[i];
        }
        return new DenseMatrixValue(rows, columns, data);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SparseMatrixValue that
                && rows == that.rows && columns == that.columns
                && Arrays.equals(rowIndices, that.rowIndices)
                && Arrays.equals(columnIndices, that.columnIndices)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = 31 * rows + columns;
        result = 31 * result + Arrays.hashCode(rowIndices);
        result = 31 * result + Arrays.hashCode(columnIndices);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "sparse" + rows + "x" + columns + "(" + values.length + " entries)";
    }
}
