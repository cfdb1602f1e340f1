package com.pricegraph.exception;

/**
 * Exception thrown when evaluation hits a condition that publish validation
 * should have rejected: a compute dependency cycle, a non-number operand,
 * or a non-finite amount.
 */
public class EvaluationException extends PriceGraphException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
