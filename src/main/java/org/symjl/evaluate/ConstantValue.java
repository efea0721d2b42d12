package org.symjl.evaluate;

import org.symjl.expr.Shape;

/**
 * Sealed interface for the concrete value of a compile-time constant.
 * 
 * Includes:
 * - ScalarValue: a plain number
 * - DenseMatrixValue: a dense array, column vectors included
 * - SparseMatrixValue: a sparse matrix in coordinate form
 */
public sealed interface ConstantValue permits ScalarValue, DenseMatrixValue, SparseMatrixValue {

    Shape shape();

    /**
     * @return This value as a dense matrix; scalars become 1x1
     */
    DenseMatrixValue toDense();
}
