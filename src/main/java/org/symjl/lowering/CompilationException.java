package org.symjl.lowering;

/**
 * Base class for failures while compiling an expression DAG.
 * 
 * Compilation is a pure function of its input, so these failures are never
 * retryable.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
