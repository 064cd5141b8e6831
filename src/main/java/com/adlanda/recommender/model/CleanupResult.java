package com.adlanda.recommender.model;

import java.util.List;

/**
 * Outcome of the daily cleanup task.
 *
 * @param orphanedEmbeddingsRemoved Index records whose item no longer exists
 * @param feedbackPurged            Processed feedback events past retention
 * @param errors                    Failures that were caught and logged
 */
public record CleanupResult(int orphanedEmbeddingsRemoved, long feedbackPurged, List<String> errors) {
}
