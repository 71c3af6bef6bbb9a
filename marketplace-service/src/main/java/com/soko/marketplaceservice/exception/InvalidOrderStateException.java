package com.soko.marketplaceservice.exception;

/**
 * Exception thrown when an order state transition is invalid.
 * For example: shipping an order that is still PENDING, or paying a cancelled order.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidOrderStateException extends RuntimeException {

    public InvalidOrderStateException(String message) {
        super(message);
    }

    public InvalidOrderStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
