package com.adlanda.recommender.repository;

import com.adlanda.recommender.entity.FeedbackEvent;
import com.adlanda.recommender.model.FeedbackSignal;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for feedback events consumed by the learning loop.
 */
@Repository
public interface FeedbackEventRepository extends JpaRepository<FeedbackEvent, UUID> {

    /**
     * Oldest unprocessed events first.
     */
    List<FeedbackEvent> findByProcessedFalseOrderByTimestampAsc(Pageable pageable);

    long countByProcessedFalse();

    /**
     * Processed ratings of the given kinds acknowledged since {@code since}.
     */
    long countByProcessedTrueAndProcessedAtGreaterThanEqualAndSignalIn(Instant since,
                                                                        Collection<FeedbackSignal> signals);

    /**
     * Acknowledges events in one statement. Events already processed are left
     * untouched, so the returned count is the number newly acknowledged.
     */
    @Modifying
    @Transactional
    @Query("UPDATE FeedbackEvent e SET e.processed = true, e.processedAt = :processedAt " +
            "WHERE e.id IN :ids AND e.processed = false")
    int markProcessed(Collection<UUID> ids, Instant processedAt);

    /**
     * Purges processed events acknowledged before {@code cutoff}.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM FeedbackEvent e WHERE e.processed = true AND e.processedAt < :cutoff")
    int deleteProcessedBefore(Instant cutoff);
}
