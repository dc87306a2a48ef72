package com.entity.sync.mutation;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk delete.
 *
 * @param deleted ids whose delete was issued (or that were discarded locally)
 * @param failed  ids that could not be deleted, with the reason
 */
public record BulkDeleteResult(List<String> deleted, Map<String, String> failed) {

    public BulkDeleteResult {
        deleted = List.copyOf(deleted);
        failed = Map.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
