package com.entity.sync.mutation;

/**
 * Thrown when the current user is neither the owner nor a controller of the entity.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
