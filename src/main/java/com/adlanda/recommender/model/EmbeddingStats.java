package com.adlanda.recommender.model;

import java.time.Instant;

/**
 * Counts reported by the stats collection task.
 */
public record EmbeddingStats(
        long itemEmbeddings,
        long userEmbeddings,
        long catalogItems,
        long pendingFeedback,
        Instant collectedAt
) {
}
