package com.pricegraph.exception;

/**
 * Exception thrown when a value cannot be canonicalized as JSON
 * (non-finite numbers, non-JSON objects, excessive nesting).
 */
public class CanonicalizationException extends PriceGraphException {

    public CanonicalizationException(String message) {
        super(message);
    }

    public CanonicalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
