package com.adlanda.recommender.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * A user's preference embedding and the text it was derived from.
 *
 * One row per user, overwritten on every recompute.
 */
@Entity
@Table(name = "user_preference_vectors")
public class UserPreferenceVector {

    @Id
    @Column(name = "user_id", length = 128)
    private String userId;

    @Convert(converter = FloatArrayConverter.class)
    @Column(name = "embedding", nullable = false, columnDefinition = "TEXT")
    private float[] vector;

    @Column(name = "source_text", nullable = false, columnDefinition = "TEXT")
    private String sourceText;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Default constructor for JPA
    protected UserPreferenceVector() {
    }

    public UserPreferenceVector(String userId, float[] vector, String sourceText, Instant updatedAt) {
        this.userId = userId;
        this.vector = vector;
        this.sourceText = sourceText;
        this.updatedAt = updatedAt;
    }

    public String getUserId() {
        return userId;
    }

    public float[] getVector() {
        return vector;
    }

    public void setVector(float[] vector) {
        this.vector = vector;
    }

    public String getSourceText() {
        return sourceText;
    }

    public void setSourceText(String sourceText) {
        this.sourceText = sourceText;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "UserPreferenceVector{" +
                "userId='" + userId + '\'' +
                ", dimensions=" + (vector != null ? vector.length : 0) +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
