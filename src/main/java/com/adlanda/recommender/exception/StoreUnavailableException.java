package com.adlanda.recommender.exception;

/**
 * The vector index, catalog or profile store could not be reached.
 */
public class StoreUnavailableException extends RecommenderException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
