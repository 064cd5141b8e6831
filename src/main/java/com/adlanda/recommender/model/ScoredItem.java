package com.adlanda.recommender.model;

import java.time.Instant;

/**
 * A single ranked match from the vector index.
 *
 * @param itemId     Catalog id of the match
 * @param similarity Cosine similarity to the query vector (higher is more similar)
 * @param metadata   Catalog snapshot stored with the vector
 * @param updatedAt  When the vector was written; breaks ties between equal scores
 */
public record ScoredItem(
        String itemId,
        double similarity,
        ItemMetadata metadata,
        Instant updatedAt
) {
    public static ScoredItem from(EmbeddingRecord record, double similarity) {
        return new ScoredItem(record.itemId(), similarity, record.metadata(), record.updatedAt());
    }
}
