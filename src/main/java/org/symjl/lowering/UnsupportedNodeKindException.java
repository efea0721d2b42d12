package org.symjl.lowering;

import org.symjl.expr.NodeKind;

/**
 * Exception thrown when lowering meets a node kind with no code generation
 * rule.
 */
public class UnsupportedNodeKindException extends CompilationException {

    private final NodeKind kind;

    public UnsupportedNodeKindException(NodeKind kind, String detail) {
        super("Conversion to Julia not implemented for a node of kind '" + kind + "': " + detail);
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }
}
