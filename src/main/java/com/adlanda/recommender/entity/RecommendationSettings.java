package com.adlanda.recommender.entity;

import com.adlanda.recommender.model.RecommendationConfig;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Persisted copy of the tuned ranking parameters, so a restart resumes with
 * the last computed threshold.
 */
@Entity
@Table(name = "recommendation_settings")
public class RecommendationSettings {

    public static final String SINGLETON_ID = "recommendations";

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "similarity_threshold", nullable = false)
    private double similarityThreshold;

    @Column(name = "helpful_ratio", nullable = false)
    private double helpfulRatio;

    @Column(name = "sample_size", nullable = false)
    private long sampleSize;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    // Default constructor for JPA
    protected RecommendationSettings() {
    }

    public static RecommendationSettings from(RecommendationConfig config) {
        RecommendationSettings settings = new RecommendationSettings();
        settings.id = SINGLETON_ID;
        settings.similarityThreshold = config.similarityThreshold();
        settings.helpfulRatio = config.helpfulRatio();
        settings.sampleSize = config.sampleSize();
        settings.lastUpdated = config.lastUpdated();
        return settings;
    }

    public RecommendationConfig toConfig() {
        return new RecommendationConfig(similarityThreshold, helpfulRatio, sampleSize, lastUpdated);
    }

    public String getId() {
        return id;
    }
}
