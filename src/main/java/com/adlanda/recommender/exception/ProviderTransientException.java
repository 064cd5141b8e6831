package com.adlanda.recommender.exception;

/**
 * A retryable embedding provider failure: timeout, rate limit or server error.
 * Triggers retry and failover to the next provider.
 */
public class ProviderTransientException extends RecommenderException {

    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
