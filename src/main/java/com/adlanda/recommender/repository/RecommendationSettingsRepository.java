package com.adlanda.recommender.repository;

import com.adlanda.recommender.entity.RecommendationSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the persisted recommendation parameters (a single row).
 */
@Repository
public interface RecommendationSettingsRepository extends JpaRepository<RecommendationSettings, String> {
}
