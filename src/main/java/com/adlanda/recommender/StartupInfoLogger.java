package com.adlanda.recommender;

import com.adlanda.recommender.provider.EmbeddingProviderChain;
import com.adlanda.recommender.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after SchedulerRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final EmbeddingProviderChain providerChain;
    private final TaskScheduler scheduler;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    @Value("${recommender.vector-store.type:pgvector}")
    private String vectorStoreType;

    public StartupInfoLogger(EmbeddingProviderChain providerChain, TaskScheduler scheduler) {
        this.providerChain = providerChain;
        this.scheduler = scheduler;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Opportunity Recommender v{}
            Vector index: {}
            Embedding providers: {}
            Scheduler: {} ({})

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, vectorStoreType, providerChain.providerNames(),
            scheduler.isRunning() ? "running" : "stopped", scheduler.status().taskNames(), port
        );
    }
}
