package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.entity.RecommendationSettings;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.RecommendationConfig;
import com.adlanda.recommender.repository.RecommendationSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link RecommendationConfig}.
 *
 * Readers always see a complete value; the learning loop replaces it as a
 * whole. The last published value is persisted and restored at startup.
 */
@Component
public class RecommendationConfigHolder {

    private static final Logger log = LoggerFactory.getLogger(RecommendationConfigHolder.class);

    private final RecommendationSettingsRepository repository;
    private final RecommenderProperties.Learning learning;
    private final Clock clock;

    private final AtomicReference<RecommendationConfig> current;

    public RecommendationConfigHolder(RecommendationSettingsRepository repository,
                                      RecommenderProperties properties,
                                      Clock clock) {
        this.repository = repository;
        this.learning = properties.getLearning();
        this.clock = clock;
        this.current = new AtomicReference<>(load());
    }

    public RecommendationConfig current() {
        return current.get();
    }

    /**
     * Derives the ranking parameters from rating counts in the trailing window:
     * {@code threshold = max(floor, helpfulRatio * scale)}.
     */
    public RecommendationConfig compute(long helpfulCount, long totalCount) {
        double helpfulRatio = totalCount > 0
                ? (double) helpfulCount / totalCount
                : learning.getDefaultHelpfulRatio();
        double threshold = Math.max(learning.getThresholdFloor(), helpfulRatio * learning.getThresholdScale());
        return new RecommendationConfig(threshold, helpfulRatio, totalCount, clock.instant());
    }

    /**
     * Makes {@code config} visible to readers, then persists it.
     *
     * @throws StoreUnavailableException if persisting failed; the new value is
     *                                   still in effect for this process
     */
    public void publish(RecommendationConfig config) {
        current.set(config);
        try {
            repository.save(RecommendationSettings.from(config));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to persist recommendation settings: " + e.getMessage(), e);
        }
    }

    private RecommendationConfig load() {
        try {
            return repository.findById(RecommendationSettings.SINGLETON_ID)
                    .map(settings -> {
                        RecommendationConfig restored = settings.toConfig();
                        log.info("Restored recommendation settings: threshold={}, ratio={}",
                                restored.similarityThreshold(), restored.helpfulRatio());
                        return restored;
                    })
                    .orElseGet(this::defaults);
        } catch (DataAccessException e) {
            log.warn("Could not load recommendation settings, using defaults: {}", e.getMessage());
            return defaults();
        }
    }

    private RecommendationConfig defaults() {
        return new RecommendationConfig(learning.getThresholdFloor(), learning.getDefaultHelpfulRatio(), 0,
                clock.instant());
    }
}
