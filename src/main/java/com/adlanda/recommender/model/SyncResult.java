package com.adlanda.recommender.model;

import java.util.List;

/**
 * Outcome of one reconciliation run between the catalog and the vector index.
 *
 * @param created    Items embedded and upserted in this run (includes re-embedded edits)
 * @param updated    Subset of {@code created} that replaced a stale record
 * @param deleted    Index records removed because their item left the catalog
 * @param skipped    Items with no embeddable text
 * @param batches    Provider batch calls issued
 * @param errors     Per-item failures; never abort the run
 * @param durationMs Wall-clock duration of the run
 */
public record SyncResult(
        int created,
        int updated,
        int deleted,
        int skipped,
        int batches,
        List<SyncError> errors,
        long durationMs
) {
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
