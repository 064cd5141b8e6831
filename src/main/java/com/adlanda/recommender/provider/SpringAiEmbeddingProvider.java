package com.adlanda.recommender.provider;

import com.adlanda.recommender.exception.ProviderFatalException;
import com.adlanda.recommender.exception.ProviderTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

/**
 * Embedding provider backed by a Spring AI {@link EmbeddingModel}
 * (OpenAI text-embedding-3-small in the default configuration).
 */
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final String name;
    private final EmbeddingModel embeddingModel;
    private final int maxBatchSize;

    public SpringAiEmbeddingProvider(String name, EmbeddingModel embeddingModel, int maxBatchSize) {
        this.name = name;
        this.embeddingModel = embeddingModel;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        try {
            List<float[]> vectors = embeddingModel.embed(texts);
            log.debug("Generated {} {} embeddings", vectors.size(), name);
            return vectors;
        } catch (TransientAiException | ResourceAccessException | HttpServerErrorException
                 | HttpClientErrorException.TooManyRequests e) {
            throw new ProviderTransientException(name + " embedding call failed: " + e.getMessage(), e);
        } catch (NonTransientAiException | HttpClientErrorException | IllegalArgumentException e) {
            throw new ProviderFatalException(name + " rejected the embedding request: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ProviderTransientException(name + " embedding call failed: " + e.getMessage(), e);
        }
    }
}
