package org.symjl.evaluate;

import org.symjl.expr.Shape;

/**
 * A scalar constant.
 */
public record ScalarValue(double value) implements ConstantValue {

    @Override
    public Shape shape() {
        return Shape.ofScalar();
    }

    @Override
    public DenseMatrixValue toDense() {
        return new DenseMatrixValue(1, 1, new double[]{value});
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
