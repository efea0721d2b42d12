package org.symjl.evaluate;

import org.symjl.expr.Shape;

import java.util.Arrays;

/**
 * A dense matrix constant stored row-major.
 */
public record DenseMatrixValue(int rows, int columns, double[] data) implements ConstantValue {

    public DenseMatrixValue {
        if (rows < 0 || columns < 1) {
            throw new IllegalArgumentException("Invalid matrix dimensions: " + rows + "x" + columns);
        }
        if (data.length != rows * columns) {
            throw new IllegalArgumentException("Expected " + rows * columns + " entries but got " + data.length);
        }
        data = data.clone();
    }

    public static DenseMatrixValue column(double... values) {
        return new DenseMatrixValue(values.length, 1, values);
    }

    public static DenseMatrixValue of(double[][] values) {
        int rows = values.length;
        int columns = rows == 0 ? 1 : values[0].length;
        double[] data = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            if (values[r].length != columns) {
                throw new IllegalArgumentException("Ragged matrix row " + r);
            }
            System.arraycopy(values[r], 0, data, r * columns, columns);
        }
        return new DenseMatrixValue(rows, columns, data);
    }

    @Override
    public double[] data() {
        return data.clone();
    }

    public double get(int row, int column) {
        return data[row * columns + column];
    }

    public boolean isColumn() {
        return columns == 1;
    }

    @Override
    public Shape shape() {
        return Shape.matrix(rows, columns);
    }

    @Override
    public DenseMatrixValue toDense() {
        return this;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DenseMatrixValue that
                && rows == that.rows && columns == that.columns && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "dense" + rows + "x" + columns + Arrays.toString(data);
    }
}
