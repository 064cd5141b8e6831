package com.adlanda.recommender.repository;

import com.adlanda.recommender.model.UserProfile;

import java.util.Optional;

/**
 * Read-only access to user profile attributes.
 */
public interface ProfileStore {

    Optional<UserProfile> getProfile(String userId);
}
