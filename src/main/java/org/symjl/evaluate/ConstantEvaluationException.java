package org.symjl.evaluate;

/**
 * Exception thrown when a constant subtree cannot be evaluated.
 */
public class ConstantEvaluationException extends RuntimeException {

    public ConstantEvaluationException(String message) {
        super(message);
    }

    public ConstantEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
