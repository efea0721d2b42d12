package org.symjl.expr;

/**
 * Shape of an expression node.
 * 
 * A scalar has no dimensions. Arrays carry a row and column count; column
 * vectors have a single column.
 * 
 * @param scalar  Whether this is a 0-dimensional shape
 * @param rows    The row count (0 for scalars)
 * @param columns The column count (0 for scalars)
 */
public record Shape(boolean scalar, int rows, int columns) {

    private static final Shape SCALAR = new Shape(true, 0, 0);

    public Shape {
        if (scalar && (rows != 0 || columns != 0)) {
            throw new IllegalArgumentException("Scalar shape cannot carry dimensions");
        }
        if (!scalar && (rows < 0 || columns < 1)) {
            throw new IllegalArgumentException("Invalid array shape: " + rows + "x" + columns);
        }
    }

    public static Shape ofScalar() {
        return SCALAR;
    }

    public static Shape vector(int rows) {
        return new Shape(false, rows, 1);
    }

    public static Shape matrix(int rows, int columns) {
        return new Shape(false, rows, columns);
    }

    /**
     * The extent used for slicing and buffer allocation: 1 for scalars,
     * otherwise the first dimension.
     */
    public int size() {
        return scalar ? 1 : rows;
    }

    @Override
    public String toString() {
        return scalar ? "()" : "(" + rows + ", " + columns + ")";
    }
}
