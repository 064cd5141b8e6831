package com.adlanda.recommender.config;

import com.adlanda.recommender.repository.InMemoryVectorIndex;
import com.adlanda.recommender.repository.PgVectorIndex;
import com.adlanda.recommender.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Selects the vector index implementation from {@code recommender.vector-store.type}.
 */
@Configuration
public class VectorStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "recommender.vector-store.type", havingValue = "pgvector", matchIfMissing = true)
    public VectorIndex pgVectorIndex(JdbcTemplate jdbcTemplate, RecommenderProperties properties) {
        PgVectorIndex index = new PgVectorIndex(jdbcTemplate);
        if (properties.getVectorStore().isInitializeSchema()) {
            index.initializeSchema();
        }
        return index;
    }

    @Bean
    @ConditionalOnProperty(name = "recommender.vector-store.type", havingValue = "memory")
    public VectorIndex inMemoryVectorIndex() {
        log.warn("Using in-memory vector index; embeddings are lost on restart");
        return new InMemoryVectorIndex();
    }
}
