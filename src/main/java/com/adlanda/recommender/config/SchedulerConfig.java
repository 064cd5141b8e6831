package com.adlanda.recommender.config;

import com.adlanda.recommender.scheduler.ScheduledTask;
import com.adlanda.recommender.scheduler.TaskScheduler;
import com.adlanda.recommender.service.EmbeddingSyncService;
import com.adlanda.recommender.service.LearningLoopService;
import com.adlanda.recommender.service.MaintenanceService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Registers the recurring recommender tasks.
 */
@Configuration
public class SchedulerConfig {

    public static final String EMBEDDING_SYNC = "embeddingSync";
    public static final String MAINTENANCE = "maintenance";
    public static final String STATS_COLLECTION = "statsCollection";
    public static final String DAILY_CLEANUP = "dailyCleanup";
    public static final String LEARNING_LOOP = "learningLoop";

    @Bean(destroyMethod = "shutdown")
    public TaskScheduler taskScheduler(RecommenderProperties properties,
                                       EmbeddingSyncService syncService,
                                       MaintenanceService maintenanceService,
                                       LearningLoopService learningLoopService,
                                       Clock clock) {
        RecommenderProperties.Scheduler config = properties.getScheduler();
        List<ScheduledTask> tasks = List.of(
                new ScheduledTask(EMBEDDING_SYNC, config.getEmbeddingSync(), config.getInitialSyncDelay(),
                        syncService::sync),
                ScheduledTask.every(MAINTENANCE, config.getMaintenance(), maintenanceService::performMaintenance),
                ScheduledTask.every(STATS_COLLECTION, config.getStatsCollection(), maintenanceService::collectStats),
                ScheduledTask.every(DAILY_CLEANUP, config.getDailyCleanup(), maintenanceService::dailyCleanup),
                ScheduledTask.every(LEARNING_LOOP, config.getLearningLoop(), learningLoopService::run)
        );
        return new TaskScheduler(tasks, clock, config.getRunNowTimeout());
    }
}
