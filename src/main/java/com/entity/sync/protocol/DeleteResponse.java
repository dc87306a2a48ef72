package com.entity.sync.protocol;

/**
 * Server answer to a delete.
 */
public record DeleteResponse(boolean success, String error) {

    public static DeleteResponse ok() {
        return new DeleteResponse(true, null);
    }

    public static DeleteResponse failed(String error) {
        return new DeleteResponse(false, error);
    }
}
