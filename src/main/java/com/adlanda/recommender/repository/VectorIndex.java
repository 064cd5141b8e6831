package com.adlanda.recommender.repository;

import com.adlanda.recommender.model.EmbeddingRecord;
import com.adlanda.recommender.model.ItemMetadata;
import com.adlanda.recommender.model.ScoredItem;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Nearest-neighbour index over catalog item embeddings.
 *
 * Each item's write is atomic; a batch of upserts is not. Implementations throw
 * {@link com.adlanda.recommender.exception.StoreUnavailableException} when the
 * backing store cannot be reached.
 */
public interface VectorIndex {

    /**
     * Inserts or replaces the record for {@code itemId}. A write whose
     * {@code updatedAt} is older than the stored record's is ignored.
     */
    void upsert(String itemId, float[] vector, ItemMetadata metadata, Instant updatedAt);

    /**
     * Removes the record for {@code itemId}; a no-op when absent.
     *
     * @return true if a record was removed
     */
    boolean delete(String itemId);

    /**
     * Returns at most {@code k} records with cosine similarity of at least
     * {@code minSimilarity}, best first; equal scores put the most recently
     * updated record first. Records of a different dimensionality than the
     * query are not comparable and are left out.
     */
    List<ScoredItem> query(float[] vector, int k, double minSimilarity);

    /**
     * Ids of every committed record. Reads the primary store, so it is never
     * staler than {@link #query}.
     */
    Set<String> listIds();

    /**
     * Content hash snapshot per indexed item, for change detection.
     */
    Map<String, String> listContentHashes();

    Optional<EmbeddingRecord> find(String itemId);

    long count();
}
