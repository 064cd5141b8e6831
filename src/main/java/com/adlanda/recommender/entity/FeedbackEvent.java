package com.adlanda.recommender.entity;

import com.adlanda.recommender.model.FeedbackSignal;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a user's reaction to a recommended opportunity.
 *
 * The learning loop consumes each event once and flips {@code processed}.
 */
@Entity
@Table(name = "feedback_events", indexes = {
        @Index(name = "idx_feedback_processed", columnList = "processed, occurred_at"),
        @Index(name = "idx_feedback_processed_at", columnList = "processed_at")
})
public class FeedbackEvent {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "item_id", nullable = false, length = 128)
    private String itemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "feedback_signal", nullable = false, length = 32)
    private FeedbackSignal signal;

    @Column(name = "occurred_at", nullable = false)
    private Instant timestamp;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "processed_at")
    private Instant processedAt;

    // Default constructor for JPA
    protected FeedbackEvent() {
    }

    public FeedbackEvent(String userId, String itemId, FeedbackSignal signal, Instant timestamp) {
        this.id = UUID.randomUUID();
        this.userId = userId;
        this.itemId = itemId;
        this.signal = signal;
        this.timestamp = timestamp;
        this.processed = false;
    }

    public UUID getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getItemId() {
        return itemId;
    }

    public FeedbackSignal getSignal() {
        return signal;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isProcessed() {
        return processed;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public void markProcessed(Instant at) {
        this.processed = true;
        this.processedAt = at;
    }

    @Override
    public String toString() {
        return "FeedbackEvent{" +
                "id=" + id +
                ", userId='" + userId + '\'' +
                ", itemId='" + itemId + '\'' +
                ", signal=" + signal +
                ", processed=" + processed +
                '}';
    }
}
