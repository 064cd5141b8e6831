package com.adlanda.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Opportunity Recommender - Main Application
 *
 * Keeps a vector index of opportunities in step with the catalog, ranks
 * opportunities for users by embedding similarity, and tunes the ranking from
 * user feedback on a schedule.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI, with Cohere as fallback
 * - PGVector for vector storage and similarity search
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class RecommenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecommenderApplication.class, args);
    }
}
