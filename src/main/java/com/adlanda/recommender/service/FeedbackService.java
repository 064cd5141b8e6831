package com.adlanda.recommender.service;

import com.adlanda.recommender.entity.FeedbackEvent;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.FeedbackSignal;
import com.adlanda.recommender.repository.FeedbackEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Records user feedback for the learning loop.
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackEventRepository repository;
    private final Clock clock;

    public FeedbackService(FeedbackEventRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Appends a feedback event. Never throws: a failure to record feedback must
     * not affect the request that produced it.
     *
     * @return true if the event was stored
     */
    public boolean recordFeedback(String userId, String itemId, FeedbackSignal signal) {
        if (isBlank(userId) || isBlank(itemId) || signal == null) {
            log.warn("Dropping incomplete feedback: user={}, item={}, signal={}", userId, itemId, signal);
            return false;
        }
        try {
            repository.save(new FeedbackEvent(userId, itemId, signal, clock.instant()));
            log.debug("Recorded {} feedback from user {} on {}", signal, userId, itemId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to record {} feedback from user {} on {}: {}", signal, userId, itemId, e.getMessage(), e);
            return false;
        }
    }

    public long countPending() {
        try {
            return repository.countByProcessedFalse();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to count pending feedback: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
