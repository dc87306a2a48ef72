package com.entity.sync.mutation;

import java.util.List;

/**
 * Thrown synchronously when a payload is rejected before anything is queued.
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Invalid payload: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
