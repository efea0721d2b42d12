package org.symjl.lowering;

/**
 * Naming scheme for generated buffers.
 */
public final class BufferNames {

    private BufferNames() {
    }

    /**
     * The identity-based name of a node's buffer, e.g. {@code cache_00042}.
     */
    public static String longName(int nodeId, BufferKind kind) {
        return String.format("%s_%05d", kind.prefix(), nodeId);
    }

    /**
     * The position-based name used in generated code, e.g. {@code const_3}.
     */
    public static String shortName(int position, BufferKind kind) {
        return kind.prefix() + "_" + position;
    }
}
