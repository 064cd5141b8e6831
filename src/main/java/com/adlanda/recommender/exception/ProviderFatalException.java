package com.adlanda.recommender.exception;

/**
 * A non-retryable embedding provider failure, typically invalid input.
 * Never triggers failover.
 */
public class ProviderFatalException extends RecommenderException {

    public ProviderFatalException(String message) {
        super(message);
    }

    public ProviderFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
