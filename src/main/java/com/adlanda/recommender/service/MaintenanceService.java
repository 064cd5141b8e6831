package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.model.CatalogItem;
import com.adlanda.recommender.model.CleanupResult;
import com.adlanda.recommender.model.EmbeddingStats;
import com.adlanda.recommender.model.MaintenanceResult;
import com.adlanda.recommender.model.SyncResult;
import com.adlanda.recommender.repository.CatalogStore;
import com.adlanda.recommender.repository.FeedbackEventRepository;
import com.adlanda.recommender.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Periodic housekeeping: statistics, sync-plus-stats maintenance and the
 * daily cleanup of orphaned embeddings and old feedback.
 */
@Service
public class MaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final EmbeddingSyncService syncService;
    private final VectorIndex vectorIndex;
    private final CatalogStore catalogStore;
    private final UserPreferenceService preferenceService;
    private final FeedbackService feedbackService;
    private final FeedbackEventRepository feedbackRepository;
    private final RecommenderProperties.Learning learning;
    private final Clock clock;

    public MaintenanceService(EmbeddingSyncService syncService,
                              VectorIndex vectorIndex,
                              CatalogStore catalogStore,
                              UserPreferenceService preferenceService,
                              FeedbackService feedbackService,
                              FeedbackEventRepository feedbackRepository,
                              RecommenderProperties properties,
                              Clock clock) {
        this.syncService = syncService;
        this.vectorIndex = vectorIndex;
        this.catalogStore = catalogStore;
        this.preferenceService = preferenceService;
        this.feedbackService = feedbackService;
        this.feedbackRepository = feedbackRepository;
        this.learning = properties.getLearning();
        this.clock = clock;
    }

    public EmbeddingStats collectStats() {
        EmbeddingStats stats = new EmbeddingStats(
                vectorIndex.count(),
                preferenceService.count(),
                catalogStore.count(),
                feedbackService.countPending(),
                clock.instant());
        log.info("Embedding stats: items={}/{}, users={}, pendingFeedback={}",
                stats.itemEmbeddings(), stats.catalogItems(), stats.userEmbeddings(), stats.pendingFeedback());
        return stats;
    }

    /**
     * Runs a sync and collects stats. A failing step does not stop the other.
     */
    public MaintenanceResult performMaintenance() {
        log.info("Starting maintenance...");
        List<String> errors = new ArrayList<>();

        SyncResult sync = null;
        try {
            sync = syncService.sync();
        } catch (RuntimeException e) {
            log.error("Maintenance sync failed: {}", e.getMessage(), e);
            errors.add("sync: " + e.getMessage());
        }

        EmbeddingStats stats = null;
        try {
            stats = collectStats();
        } catch (RuntimeException e) {
            log.error("Maintenance stats failed: {}", e.getMessage(), e);
            errors.add("stats: " + e.getMessage());
        }

        return new MaintenanceResult(sync, stats, List.copyOf(errors));
    }

    /**
     * Removes index records whose item left the catalog and purges processed
     * feedback older than the retention period.
     */
    public CleanupResult dailyCleanup() {
        log.info("Starting daily cleanup...");
        List<String> errors = new ArrayList<>();

        int orphansRemoved = 0;
        try {
            orphansRemoved = removeOrphans(errors);
        } catch (RuntimeException e) {
            log.error("Orphan cleanup failed: {}", e.getMessage(), e);
            errors.add("orphans: " + e.getMessage());
        }

        long purged = 0;
        try {
            Instant cutoff = clock.instant().minus(learning.getProcessedRetention());
            purged = feedbackRepository.deleteProcessedBefore(cutoff);
        } catch (RuntimeException e) {
            log.error("Feedback purge failed: {}", e.getMessage(), e);
            errors.add("feedback: " + e.getMessage());
        }

        log.info("Daily cleanup complete: {} orphaned embeddings removed, {} feedback events purged",
                orphansRemoved, purged);
        return new CleanupResult(orphansRemoved, purged, List.copyOf(errors));
    }

    private int removeOrphans(List<String> errors) {
        Set<String> catalogIds = catalogStore.getAll().stream()
                .map(CatalogItem::id)
                .collect(Collectors.toSet());
        Set<String> orphans = new HashSet<>(vectorIndex.listIds());
        orphans.removeAll(catalogIds);

        int removed = 0;
        for (String itemId : orphans) {
            try {
                if (vectorIndex.delete(itemId)) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to remove orphaned embedding {}: {}", itemId, e.getMessage());
                errors.add("orphan " + itemId + ": " + e.getMessage());
            }
        }
        return removed;
    }
}
