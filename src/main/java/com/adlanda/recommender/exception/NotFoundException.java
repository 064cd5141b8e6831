package com.adlanda.recommender.exception;

/**
 * An item or user id is unknown. An empty result set is not reported this way.
 */
public class NotFoundException extends RecommenderException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException item(String itemId) {
        return new NotFoundException("Opportunity not found: " + itemId);
    }

    public static NotFoundException user(String userId) {
        return new NotFoundException("User profile not found: " + userId);
    }
}
