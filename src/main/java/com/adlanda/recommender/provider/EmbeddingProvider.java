package com.adlanda.recommender.provider;

import java.util.List;

/**
 * One embedding backend in the provider chain.
 *
 * Implementations report retryable failures as
 * {@link com.adlanda.recommender.exception.ProviderTransientException} and
 * caller errors as {@link com.adlanda.recommender.exception.ProviderFatalException}.
 */
public interface EmbeddingProvider {

    /**
     * Short name used in logs, e.g. "openai".
     */
    String name();

    /**
     * Largest number of texts accepted by a single {@link #embed} call.
     */
    int maxBatchSize();

    /**
     * Embeds each text; the result has the same order and size as the input.
     */
    List<float[]> embed(List<String> texts);
}
