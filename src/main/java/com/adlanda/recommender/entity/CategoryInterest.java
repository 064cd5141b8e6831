package com.adlanda.recommender.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/**
 * Weighted engagement tally for one user and one opportunity category.
 */
@Entity
@Table(name = "category_interests",
        uniqueConstraints = @UniqueConstraint(name = "uk_interest_user_category", columnNames = {"user_id", "category"}))
public class CategoryInterest {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "category", nullable = false, length = 200)
    private String category;

    @Column(name = "weight", nullable = false)
    private double weight;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Default constructor for JPA
    protected CategoryInterest() {
    }

    public CategoryInterest(String userId, String category, Instant updatedAt) {
        this.id = UUID.randomUUID();
        this.userId = userId;
        this.category = category;
        this.weight = 0.0;
        this.updatedAt = updatedAt;
    }

    /**
     * Adds {@code delta} to the weight. Weights never go below zero.
     */
    public void adjust(double delta, Instant at) {
        this.weight = Math.max(0.0, this.weight + delta);
        this.updatedAt = at;
    }

    public UUID getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getCategory() {
        return category;
    }

    public double getWeight() {
        return weight;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
