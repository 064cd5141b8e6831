package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.entity.CategoryInterest;
import com.adlanda.recommender.entity.FeedbackEvent;
import com.adlanda.recommender.model.CatalogItem;
import com.adlanda.recommender.model.EmbeddingRecord;
import com.adlanda.recommender.model.FeedbackSignal;
import com.adlanda.recommender.model.LearningRunResult;
import com.adlanda.recommender.model.RecommendationConfig;
import com.adlanda.recommender.repository.CatalogStore;
import com.adlanda.recommender.repository.CategoryInterestRepository;
import com.adlanda.recommender.repository.FeedbackEventRepository;
import com.adlanda.recommender.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Consumes feedback events and adapts ranking to them.
 *
 * One pass:
 * 1. takes the oldest unprocessed events, up to the batch limit
 * 2. per event, in one transaction: acknowledges it, then applies an
 *    engagement signal to the user's category interest tally
 * 3. recomputes the similarity threshold from ratings in the trailing window
 * 4. recomputes preference vectors of engaged users whose vector is due
 *
 * Failures are logged and reported in the result; a pass never throws.
 */
@Service
public class LearningLoopService {

    private static final Logger log = LoggerFactory.getLogger(LearningLoopService.class);

    private static final Set<FeedbackSignal> RATINGS =
            EnumSet.of(FeedbackSignal.HELPFUL, FeedbackSignal.SOMEWHAT_HELPFUL, FeedbackSignal.NOT_HELPFUL);

    private final FeedbackEventRepository feedbackRepository;
    private final CategoryInterestRepository interestRepository;
    private final VectorIndex vectorIndex;
    private final CatalogStore catalogStore;
    private final UserPreferenceService preferenceService;
    private final RecommendationConfigHolder configHolder;
    private final RecommenderProperties.Learning learning;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public LearningLoopService(FeedbackEventRepository feedbackRepository,
                               CategoryInterestRepository interestRepository,
                               VectorIndex vectorIndex,
                               CatalogStore catalogStore,
                               UserPreferenceService preferenceService,
                               RecommendationConfigHolder configHolder,
                               RecommenderProperties properties,
                               TransactionTemplate transactionTemplate,
                               Clock clock) {
        this.feedbackRepository = feedbackRepository;
        this.interestRepository = interestRepository;
        this.vectorIndex = vectorIndex;
        this.catalogStore = catalogStore;
        this.preferenceService = preferenceService;
        this.configHolder = configHolder;
        this.learning = properties.getLearning();
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public LearningRunResult run() {
        List<String> errors = new ArrayList<>();
        try {
            return runPass(errors);
        } catch (RuntimeException e) {
            log.error("Learning loop pass failed: {}", e.getMessage(), e);
            errors.add(e.getMessage());
            return new LearningRunResult(0, 0, 0, 0, configHolder.current(), List.copyOf(errors));
        }
    }

    private LearningRunResult runPass(List<String> errors) {
        Instant now = clock.instant();

        List<FeedbackEvent> events = feedbackRepository.findByProcessedFalseOrderByTimestampAsc(
                PageRequest.of(0, learning.getBatchLimit()));
        log.info("Learning loop: {} unprocessed feedback events", events.size());

        int acknowledged = 0;
        Set<String> engagedUsers = new LinkedHashSet<>();
        Map<String, Optional<String>> categories = new HashMap<>();

        for (FeedbackEvent event : events) {
            try {
                Optional<String> category = event.getSignal().isEngagement()
                        ? categories.computeIfAbsent(event.getItemId(), this::categoryOf)
                        : Optional.empty();
                Outcome outcome = transactionTemplate.execute(status -> consume(event, category, now));
                if (outcome == Outcome.ALREADY_PROCESSED) {
                    continue;
                }
                acknowledged++;
                if (outcome == Outcome.TALLIED) {
                    engagedUsers.add(event.getUserId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to process feedback event {}: {}", event.getId(), e.getMessage());
                errors.add("event " + event.getId() + ": " + e.getMessage());
            }
        }

        long ratings = updateConfig(now, errors);
        int refreshed = refreshPreferences(engagedUsers, errors);

        RecommendationConfig config = configHolder.current();
        log.info("Learning loop complete: processed={}/{}, ratings={}, threshold={}, usersRefreshed={}, errors={}",
                acknowledged, events.size(), ratings, config.similarityThreshold(), refreshed, errors.size());
        return new LearningRunResult(events.size(), acknowledged, ratings, refreshed, config, List.copyOf(errors));
    }

    /**
     * Runs inside the event's transaction. An acknowledgement that updates no
     * row means another pass consumed the event, and it is not tallied again.
     */
    private Outcome consume(FeedbackEvent event, Optional<String> category, Instant now) {
        if (feedbackRepository.markProcessed(List.of(event.getId()), now) == 0) {
            log.debug("Feedback event {} already acknowledged", event.getId());
            return Outcome.ALREADY_PROCESSED;
        }
        if (!event.getSignal().isEngagement()) {
            return Outcome.ACKNOWLEDGED;
        }
        if (category.isEmpty()) {
            log.debug("No category for opportunity {}, skipping interest update", event.getItemId());
            return Outcome.ACKNOWLEDGED;
        }

        CategoryInterest interest = interestRepository
                .findByUserIdAndCategory(event.getUserId(), category.get())
                .orElseGet(() -> new CategoryInterest(event.getUserId(), category.get(), now));
        interest.adjust(event.getSignal().interestWeight(), now);
        interestRepository.save(interest);
        return Outcome.TALLIED;
    }

    private Optional<String> categoryOf(String itemId) {
        Optional<String> indexed = vectorIndex.find(itemId)
                .map(EmbeddingRecord::metadata)
                .map(metadata -> metadata.category());
        if (indexed.isPresent()) {
            return indexed.filter(c -> !c.isBlank());
        }
        return catalogStore.getById(itemId)
                .map(CatalogItem::category)
                .filter(c -> !c.isBlank());
    }

    /**
     * @return Ratings counted in the window
     */
    private long updateConfig(Instant now, List<String> errors) {
        try {
            Instant since = now.minus(learning.getWindow());
            long helpful = feedbackRepository.countByProcessedTrueAndProcessedAtGreaterThanEqualAndSignalIn(
                    since, EnumSet.of(FeedbackSignal.HELPFUL));
            long total = feedbackRepository.countByProcessedTrueAndProcessedAtGreaterThanEqualAndSignalIn(
                    since, RATINGS);

            RecommendationConfig config = configHolder.compute(helpful, total);
            configHolder.publish(config);
            log.info("Updated recommendation parameters: threshold={}, ratio={} ({} ratings)",
                    config.similarityThreshold(), config.helpfulRatio(), total);
            return total;
        } catch (RuntimeException e) {
            log.error("Failed to update recommendation parameters: {}", e.getMessage(), e);
            errors.add("config: " + e.getMessage());
            return 0;
        }
    }

    private int refreshPreferences(Set<String> userIds, List<String> errors) {
        int refreshed = 0;
        for (String userId : userIds) {
            try {
                if (preferenceService.isRefreshDue(userId)) {
                    preferenceService.recompute(userId);
                    refreshed++;
                } else {
                    log.debug("Preference vector for user {} is recent, not refreshing", userId);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to refresh preference vector for user {}: {}", userId, e.getMessage());
                errors.add("user " + userId + ": " + e.getMessage());
            }
        }
        return refreshed;
    }

    private enum Outcome {
        ALREADY_PROCESSED,
        ACKNOWLEDGED,
        TALLIED
    }
}
