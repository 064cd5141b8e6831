package com.adlanda.recommender.model;

import java.util.List;

/**
 * Outcome of the maintenance task. Each step is isolated; a failed step leaves
 * its field null and records an error.
 */
public record MaintenanceResult(SyncResult sync, EmbeddingStats stats, List<String> errors) {
}
