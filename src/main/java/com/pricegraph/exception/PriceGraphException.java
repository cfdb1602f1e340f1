package com.pricegraph.exception;

/**
 * Base exception for the PriceGraph engine.
 */
public class PriceGraphException extends RuntimeException {

    public PriceGraphException(String message) {
        super(message);
    }

    public PriceGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
