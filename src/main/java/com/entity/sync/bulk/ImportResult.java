package com.entity.sync.bulk;

import java.util.List;

/**
 * Result of an import.
 *
 * @param totalRecords number of entity records found in the document
 * @param createdIds   temporary ids of the entities created optimistically
 * @param errors       records that were rejected
 * @param warnings     non-fatal findings, such as an unexpected format version
 */
public record ImportResult(
        long totalRecords,
        List<String> createdIds,
        List<ImportError> errors,
        List<String> warnings
) {
    public ImportResult {
        createdIds = createdIds != null ? List.copyOf(createdIds) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public long createdCount() {
        return createdIds.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be imported.
     *
     * @param index     position of the record in the document (0-based), -1 for document-level errors
     * @param inputName the entity name, if any
     * @param message   what went wrong
     */
    public record ImportError(long index, String inputName, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", created=" + createdIds.size() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() + '}';
    }
}
