package com.soko.common.exception;

/**
 * Exception thrown when a caller tries to act on an order, message or payment they are not
 * entitled to. HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
