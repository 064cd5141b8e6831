package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.exception.NotFoundException;
import com.adlanda.recommender.exception.RecommenderException;
import com.adlanda.recommender.model.CatalogItem;
import com.adlanda.recommender.model.EmbeddingRecord;
import com.adlanda.recommender.model.RankedList;
import com.adlanda.recommender.model.ScoredItem;
import com.adlanda.recommender.provider.EmbeddingProviderChain;
import com.adlanda.recommender.repository.CatalogStore;
import com.adlanda.recommender.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Ranks opportunities by similarity to a user's preferences, to another
 * opportunity, or to free text.
 *
 * Personalised ranking degrades to the most recent catalog items when no
 * preference vector can be obtained or nothing clears the similarity threshold.
 * The result is then flagged as degraded.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final VectorIndex vectorIndex;
    private final CatalogStore catalogStore;
    private final EmbeddingProviderChain providerChain;
    private final EmbeddingTextBuilder textBuilder;
    private final UserPreferenceService preferenceService;
    private final RecommendationConfigHolder configHolder;
    private final RequestRateLimiter rateLimiter;
    private final RecommenderProperties.Recommendation config;

    public RecommendationService(VectorIndex vectorIndex,
                                 CatalogStore catalogStore,
                                 EmbeddingProviderChain providerChain,
                                 EmbeddingTextBuilder textBuilder,
                                 UserPreferenceService preferenceService,
                                 RecommendationConfigHolder configHolder,
                                 RequestRateLimiter rateLimiter,
                                 RecommenderProperties properties) {
        this.vectorIndex = vectorIndex;
        this.catalogStore = catalogStore;
        this.providerChain = providerChain;
        this.textBuilder = textBuilder;
        this.preferenceService = preferenceService;
        this.configHolder = configHolder;
        this.rateLimiter = rateLimiter;
        this.config = properties.getRecommendation();
    }

    /**
     * Personalised recommendations for {@code userId}.
     *
     * @throws com.adlanda.recommender.exception.RateLimitExceededException if the user is over budget
     * @throws RecommenderException only if both the personalised path and the
     *                              recent-items fallback failed
     */
    public RankedList recommend(String userId, int k) {
        requirePositive(k);
        rateLimiter.checkAllowed(userId);

        double threshold = configHolder.current().similarityThreshold();
        List<ScoredItem> items;
        try {
            float[] preference = preferenceService.getOrDerive(userId).getVector();
            items = vectorIndex.query(preference, k, threshold);
        } catch (RecommenderException e) {
            log.warn("Personalized ranking unavailable for user {}: {}", userId, e.getMessage());
            return recentFallback(k, e);
        }

        if (items.isEmpty()) {
            log.info("No opportunities above threshold {} for user {}, using recent items", threshold, userId);
            return recentFallback(k, null);
        }

        log.debug("Returning {} personalized recommendations for user {}", items.size(), userId);
        return RankedList.personalized(items);
    }

    /**
     * Opportunities similar to {@code itemId}, excluding the item itself.
     *
     * @throws NotFoundException if the item is neither indexed nor in the catalog
     */
    public RankedList findSimilar(String itemId, int k) {
        requirePositive(k);

        float[] vector = vectorFor(itemId);
        if (vector.length == 0) {
            return RankedList.similar(List.of());
        }

        List<ScoredItem> items = vectorIndex.query(vector, k + 1, config.getSimilarThreshold()).stream()
                .filter(item -> !item.itemId().equals(itemId))
                .limit(k)
                .toList();
        return RankedList.similar(items);
    }

    /**
     * Free-text search over the index.
     *
     * @param threshold Minimum similarity, or null for the configured default
     */
    public RankedList search(String text, int k, Double threshold) {
        requirePositive(k);
        double minSimilarity = threshold != null ? threshold : config.getDefaultSearchThreshold();
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1");
        }

        float[] vector = providerChain.embed(text);
        return RankedList.search(vectorIndex.query(vector, k, minSimilarity));
    }

    /**
     * Free-text search on behalf of a user, counted against their request budget.
     */
    public RankedList search(String userId, String text, int k, Double threshold) {
        rateLimiter.checkAllowed(userId);
        return search(text, k, threshold);
    }

    private float[] vectorFor(String itemId) {
        Optional<EmbeddingRecord> record = vectorIndex.find(itemId);
        if (record.isPresent() && record.get().hasVector()) {
            return record.get().vector();
        }

        CatalogItem item = catalogStore.getById(itemId).orElseThrow(() -> NotFoundException.item(itemId));
        String text = textBuilder.forItem(item);
        if (text.isEmpty()) {
            log.warn("Opportunity {} has no text to compare", itemId);
            return new float[0];
        }
        return providerChain.embed(text);
    }

    private RankedList recentFallback(int k, RecommenderException cause) {
        List<CatalogItem> recent;
        try {
            recent = catalogStore.getMostRecent(k);
        } catch (RuntimeException e) {
            if (cause != null) {
                cause.addSuppressed(e);
                throw cause;
            }
            throw e;
        }

        List<ScoredItem> items = recent.stream()
                .map(item -> new ScoredItem(item.id(), config.getFallbackSimilarity(),
                        item.toMetadata(null), item.createdAt()))
                .toList();
        return RankedList.recentFallback(items);
    }

    private static void requirePositive(int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
    }
}
