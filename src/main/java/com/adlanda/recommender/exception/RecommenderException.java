package com.adlanda.recommender.exception;

/**
 * Base class for failures raised by the recommender core.
 */
public class RecommenderException extends RuntimeException {

    public RecommenderException(String message) {
        super(message);
    }

    public RecommenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
