package com.entity.sync.core.model;

/**
 * Why a pending operation was rolled back.
 */
public enum FailureReason {
    /** No response arrived before the deadline. */
    TIMEOUT,
    /** The request could not be sent or its future completed exceptionally. */
    TRANSPORT,
    /** The server answered with a failure. */
    REJECTED
}
