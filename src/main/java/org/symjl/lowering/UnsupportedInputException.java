package org.symjl.lowering;

/**
 * Exception thrown when a node is of a supported kind but carries data the
 * code generator cannot express, such as a non-contiguous state selection.
 */
public class UnsupportedInputException extends CompilationException {

    private final String reason;

    public UnsupportedInputException(String reason) {
        super("Unsupported input: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
