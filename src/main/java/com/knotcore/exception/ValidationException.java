package com.knotcore.exception;

/**
 * Exception thrown when input violates a domain rule (ranges, enum values, vector dimension).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String field, Object value, String reason) {
        super(String.format("Invalid %s '%s': %s", field, value, reason));
    }
}
