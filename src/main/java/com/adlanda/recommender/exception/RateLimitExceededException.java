package com.adlanda.recommender.exception;

/**
 * The user has used up their request budget for the current window.
 */
public class RateLimitExceededException extends RecommenderException {

    private final String userId;

    public RateLimitExceededException(String userId) {
        super("Rate limit exceeded for user " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
