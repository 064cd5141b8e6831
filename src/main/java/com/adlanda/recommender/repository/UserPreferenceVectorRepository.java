package com.adlanda.recommender.repository;

import com.adlanda.recommender.entity.UserPreferenceVector;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for per-user preference embeddings.
 */
@Repository
public interface UserPreferenceVectorRepository extends JpaRepository<UserPreferenceVector, String> {
}
