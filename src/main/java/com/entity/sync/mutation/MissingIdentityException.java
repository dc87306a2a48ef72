package com.entity.sync.mutation;

/**
 * Thrown when a mutation is attempted without an authenticated user. Nothing is queued.
 */
public class MissingIdentityException extends RuntimeException {

    public MissingIdentityException(String message) {
        super(message);
    }
}
