package com.adlanda.recommender.exception;

/**
 * Every configured embedding provider failed for a call.
 */
public class EmbeddingUnavailableException extends RecommenderException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
