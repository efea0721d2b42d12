package org.symjl.lowering;

import org.symjl.evaluate.ConstantValue;

import java.util.Objects;

/**
 * An entry of the constant table.
 */
public record LoweredConstant(int nodeId, ConstantValue value) {

    public LoweredConstant {
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
