package org.symjl.expr;

/**
 * A 0-based half-open range {@code [start, stop)}.
 */
public record Slice(int start, int stop) {

    public Slice {
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("Invalid slice [" + start + ", " + stop + ")");
        }
    }

    public int length() {
        return stop - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + stop + ")";
    }
}
