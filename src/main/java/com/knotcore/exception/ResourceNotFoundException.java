package com.knotcore.exception;

import java.util.UUID;

/**
 * Exception thrown when a vault, milestone, hint, recommendation or notification does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, UUID id) {
        super(String.format("%s with id '%s' not found", resource, id));
    }
}
