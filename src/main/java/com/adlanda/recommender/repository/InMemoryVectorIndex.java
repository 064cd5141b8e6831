package com.adlanda.recommender.repository;

import com.adlanda.recommender.model.EmbeddingRecord;
import com.adlanda.recommender.model.ItemMetadata;
import com.adlanda.recommender.model.ScoredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index for local runs and tests.
 *
 * Not durable: contents are lost when the process stops.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    static final Comparator<ScoredItem> RANKING = Comparator
            .comparingDouble(ScoredItem::similarity).reversed()
            .thenComparing(ScoredItem::updatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, EmbeddingRecord> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(String itemId, float[] vector, ItemMetadata metadata, Instant updatedAt) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Cannot store item without embedding: " + itemId);
        }
        EmbeddingRecord incoming = new EmbeddingRecord(itemId, vector.clone(), metadata, updatedAt);
        records.compute(itemId, (id, existing) -> {
            if (existing != null && existing.updatedAt().isAfter(updatedAt)) {
                log.debug("Ignoring stale write for {} ({} < {})", itemId, updatedAt, existing.updatedAt());
                return existing;
            }
            return incoming;
        });
    }

    @Override
    public boolean delete(String itemId) {
        return records.remove(itemId) != null;
    }

    @Override
    public List<ScoredItem> query(float[] vector, int k, double minSimilarity) {
        if (k <= 0) {
            return List.of();
        }
        return records.values().stream()
                .filter(EmbeddingRecord::hasVector)
                .filter(record -> record.vector().length == vector.length)
                .map(record -> ScoredItem.from(record, cosineSimilarity(vector, record.vector())))
                .filter(scored -> scored.similarity() >= minSimilarity)
                .sorted(RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public Set<String> listIds() {
        return Set.copyOf(records.keySet());
    }

    @Override
    public Map<String, String> listContentHashes() {
        Map<String, String> hashes = new HashMap<>();
        records.forEach((id, record) -> hashes.put(id,
                record.metadata() != null ? record.metadata().contentHash() : null));
        return hashes;
    }

    @Override
    public Optional<EmbeddingRecord> find(String itemId) {
        return Optional.ofNullable(records.get(itemId));
    }

    @Override
    public long count() {
        return records.size();
    }

    /**
     * Removes every record.
     */
    public void clear() {
        records.clear();
    }

    /**
     * Computes cosine similarity between two vectors of equal length.
     *
     * @return Similarity in [-1, 1]; 0 when either vector has zero norm
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
