package com.soko.common.exception;

/**
 * Exception thrown when a referenced product, order, message or user does not exist.
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
