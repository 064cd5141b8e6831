package com.adlanda.recommender.model;

import java.util.Map;

/**
 * Profile attributes read from the profile store.
 *
 * Values are strings or lists of strings (e.g. careerInterests).
 */
public record UserProfile(String userId, Map<String, Object> preferences) {

    public static UserProfile empty(String userId) {
        return new UserProfile(userId, Map.of());
    }
}
