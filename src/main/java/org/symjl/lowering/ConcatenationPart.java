package org.symjl.lowering;

import java.util.Objects;

/**
 * One block of a concatenation: {@code size} consecutive entries taken from
 * {@code value}.
 */
public record ConcatenationPart(int size, Operand value) {

    public ConcatenationPart {
        Objects.requireNonNull(value, "Value cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Part size cannot be negative: " + size);
        }
    }
}
