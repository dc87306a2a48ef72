package com.entity.sync.bulk;

/**
 * Result of an export.
 *
 * @param totalEntities number of entities written
 * @param format        the document format version
 */
public record ExportResult(long totalEntities, String format) {

    @Override
    public String toString() {
        return "ExportResult{entities=" + totalEntities + ", format=" + format + '}';
    }
}
