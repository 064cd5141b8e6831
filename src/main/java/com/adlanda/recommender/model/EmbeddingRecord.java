package com.adlanda.recommender.model;

import java.time.Instant;

/**
 * The indexed vector for one catalog item.
 *
 * @param itemId    Catalog id, unique in the index
 * @param vector    Embedding, dimensionality fixed by the active provider
 * @param metadata  Catalog snapshot
 * @param updatedAt Write timestamp; upserts are last-writer-wins on this value
 */
public record EmbeddingRecord(
        String itemId,
        float[] vector,
        ItemMetadata metadata,
        Instant updatedAt
) {
    public boolean hasVector() {
        return vector != null && vector.length > 0;
    }
}
