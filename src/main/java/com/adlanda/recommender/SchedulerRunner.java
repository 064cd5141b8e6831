package com.adlanda.recommender;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the recurring tasks on application startup unless
 * {@code recommender.scheduler.auto-start} is false.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class SchedulerRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchedulerRunner.class);

    private final TaskScheduler scheduler;
    private final RecommenderProperties properties;

    public SchedulerRunner(TaskScheduler scheduler, RecommenderProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getScheduler().isAutoStart()) {
            log.info("Scheduler auto-start disabled");
            return;
        }
        scheduler.start();
    }
}
