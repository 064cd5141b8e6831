package com.adlanda.recommender.model;

import java.time.Instant;

/**
 * Process-wide ranking parameters tuned by the learning loop.
 *
 * Immutable; writers publish a new instance rather than mutating fields.
 *
 * @param similarityThreshold Minimum similarity for personalised results (0..1)
 * @param helpfulRatio        Share of "helpful" ratings in the trailing window
 * @param sampleSize          Number of ratings the ratio was computed from
 * @param lastUpdated         When the values were computed
 */
public record RecommendationConfig(
        double similarityThreshold,
        double helpfulRatio,
        long sampleSize,
        Instant lastUpdated
) {
}
