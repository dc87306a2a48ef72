package com.entity.sync.core.model;

/**
 * Kind of a locally issued mutation.
 */
public enum OperationKind {
    CREATE,
    UPDATE,
    DELETE
}
