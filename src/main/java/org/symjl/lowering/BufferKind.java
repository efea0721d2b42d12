package org.symjl.lowering;

/**
 * Whether a buffer holds a compile-time constant or a value computed on
 * every call.
 */
public enum BufferKind {
    CONST("const"),
    CACHE("cache");

    private final String prefix;

    BufferKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
