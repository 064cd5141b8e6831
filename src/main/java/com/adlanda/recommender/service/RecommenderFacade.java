package com.adlanda.recommender.service;

import com.adlanda.recommender.entity.UserPreferenceVector;
import com.adlanda.recommender.model.EmbeddingStats;
import com.adlanda.recommender.model.FeedbackSignal;
import com.adlanda.recommender.model.RankedList;
import com.adlanda.recommender.model.SyncResult;
import com.adlanda.recommender.scheduler.SchedulerStatus;
import com.adlanda.recommender.scheduler.TaskRunResult;
import com.adlanda.recommender.scheduler.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Entry point for the HTTP or CLI layer.
 */
@Service
public class RecommenderFacade {

    private final EmbeddingSyncService syncService;
    private final RecommendationService recommendationService;
    private final UserPreferenceService preferenceService;
    private final FeedbackService feedbackService;
    private final MaintenanceService maintenanceService;
    private final TaskScheduler scheduler;

    public RecommenderFacade(EmbeddingSyncService syncService,
                             RecommendationService recommendationService,
                             UserPreferenceService preferenceService,
                             FeedbackService feedbackService,
                             MaintenanceService maintenanceService,
                             TaskScheduler scheduler) {
        this.syncService = syncService;
        this.recommendationService = recommendationService;
        this.preferenceService = preferenceService;
        this.feedbackService = feedbackService;
        this.maintenanceService = maintenanceService;
        this.scheduler = scheduler;
    }

    public SyncResult sync() {
        return syncService.sync();
    }

    public SyncResult forceResync() {
        return syncService.forceResync();
    }

    public RankedList recommend(String userId, int k) {
        return recommendationService.recommend(userId, k);
    }

    public RankedList findSimilar(String itemId, int k) {
        return recommendationService.findSimilar(itemId, k);
    }

    public RankedList search(String text, int k, Double threshold) {
        return recommendationService.search(text, k, threshold);
    }

    public RankedList search(String userId, String text, int k, Double threshold) {
        return recommendationService.search(userId, text, k, threshold);
    }

    /**
     * Fire-and-forget; never throws.
     */
    public void recordFeedback(String userId, String itemId, FeedbackSignal signal) {
        feedbackService.recordFeedback(userId, itemId, signal);
    }

    public UserPreferenceVector refreshUserPreference(String userId) {
        return preferenceService.recompute(userId);
    }

    public EmbeddingStats stats() {
        return maintenanceService.collectStats();
    }

    public SchedulerStatus schedulerStatus() {
        return scheduler.status();
    }

    /**
     * @return false if the scheduler was already running
     */
    public boolean schedulerStart() {
        return scheduler.start();
    }

    /**
     * @return false if the scheduler was already stopped
     */
    public boolean schedulerStop() {
        return scheduler.stop();
    }

    public TaskRunResult runTaskNow(String taskName) {
        return scheduler.runNow(taskName);
    }
}
