package com.adlanda.recommender.config;

import com.adlanda.recommender.provider.CohereEmbeddingProvider;
import com.adlanda.recommender.provider.EmbeddingProvider;
import com.adlanda.recommender.provider.EmbeddingProviderChain;
import com.adlanda.recommender.provider.SpringAiEmbeddingProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the ordered embedding provider chain.
 *
 * OpenAI (through Spring AI) is the primary provider, Cohere the fallback.
 * A provider without credentials is left out of the chain.
 */
@Configuration
public class EmbeddingProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviderConfig.class);

    @Bean(destroyMethod = "shutdown")
    public EmbeddingProviderChain embeddingProviderChain(RecommenderProperties properties,
                                                         ObjectProvider<EmbeddingModel> embeddingModel,
                                                         ObjectMapper objectMapper) {
        RecommenderProperties.Embedding config = properties.getEmbedding();
        List<EmbeddingProvider> providers = new ArrayList<>();

        EmbeddingModel openAiModel = embeddingModel.getIfAvailable();
        if (config.getOpenai().isEnabled() && openAiModel != null) {
            providers.add(new SpringAiEmbeddingProvider("openai", openAiModel, config.getOpenai().getMaxBatchSize()));
        } else {
            log.warn("OpenAI embedding provider not configured, omitting it from the chain");
        }

        RecommenderProperties.Embedding.Cohere cohere = config.getCohere();
        if (cohere.getApiKey() != null && !cohere.getApiKey().isBlank()) {
            HttpClient httpClient = HttpClient.newBuilder()
                    .connectTimeout(config.getTimeout())
                    .build();
            providers.add(new CohereEmbeddingProvider(httpClient, objectMapper, cohere.getUrl(),
                    cohere.getApiKey(), cohere.getModel(), cohere.getMaxBatchSize(), config.getTimeout()));
        } else {
            log.info("Cohere API key not set, running without fallback embedding provider");
        }

        EmbeddingProviderChain chain = new EmbeddingProviderChain(providers, config.getTimeout(), config.getRetryBackoff());
        log.info("Embedding provider chain: {}", chain.providerNames());
        return chain;
    }
}
