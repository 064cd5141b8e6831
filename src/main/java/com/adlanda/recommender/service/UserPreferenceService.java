package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.entity.CategoryInterest;
import com.adlanda.recommender.entity.UserPreferenceVector;
import com.adlanda.recommender.exception.NotFoundException;
import com.adlanda.recommender.exception.StoreUnavailableException;
import com.adlanda.recommender.model.UserProfile;
import com.adlanda.recommender.provider.EmbeddingProviderChain;
import com.adlanda.recommender.repository.CategoryInterestRepository;
import com.adlanda.recommender.repository.ProfileStore;
import com.adlanda.recommender.repository.UserPreferenceVectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maintains the per-user preference embeddings.
 *
 * A vector is derived lazily on first use and recomputed on explicit request
 * or when the learning loop sees new engagement.
 */
@Service
public class UserPreferenceService {

    private static final Logger log = LoggerFactory.getLogger(UserPreferenceService.class);

    private final UserPreferenceVectorRepository vectorRepository;
    private final CategoryInterestRepository interestRepository;
    private final ProfileStore profileStore;
    private final EmbeddingProviderChain providerChain;
    private final EmbeddingTextBuilder textBuilder;
    private final RecommenderProperties.Learning learning;
    private final Clock clock;

    public UserPreferenceService(UserPreferenceVectorRepository vectorRepository,
                                 CategoryInterestRepository interestRepository,
                                 ProfileStore profileStore,
                                 EmbeddingProviderChain providerChain,
                                 EmbeddingTextBuilder textBuilder,
                                 RecommenderProperties properties,
                                 Clock clock) {
        this.vectorRepository = vectorRepository;
        this.interestRepository = interestRepository;
        this.profileStore = profileStore;
        this.providerChain = providerChain;
        this.textBuilder = textBuilder;
        this.learning = properties.getLearning();
        this.clock = clock;
    }

    public Optional<UserPreferenceVector> find(String userId) {
        return withStore("load preference vector", () -> vectorRepository.findById(userId));
    }

    /**
     * Returns the stored vector, deriving and persisting one from the user's
     * profile if there is none.
     *
     * @throws NotFoundException if the user has no profile or no usable attributes
     */
    public UserPreferenceVector getOrDerive(String userId) {
        Optional<UserPreferenceVector> stored = find(userId);
        if (stored.isPresent() && stored.get().getVector().length > 0) {
            return stored.get();
        }
        log.info("No preference vector for user {}, deriving from profile", userId);
        return recompute(userId);
    }

    /**
     * Rebuilds the preference text from the profile and the strongest category
     * interests, embeds it and overwrites the stored vector.
     */
    public UserPreferenceVector recompute(String userId) {
        UserProfile profile = profileStore.getProfile(userId)
                .orElseThrow(() -> NotFoundException.user(userId));

        List<CategoryInterest> interests = withStore("load category interests",
                () -> interestRepository.findByUserIdOrderByWeightDesc(userId));
        List<CategoryInterest> top = interests.stream().limit(learning.getTopCategories()).toList();

        String text = textBuilder.forProfile(profile, top);
        if (text.isEmpty()) {
            throw new NotFoundException("User " + userId + " has no preference attributes to embed");
        }

        float[] vector = providerChain.embed(text);
        Instant now = clock.instant();

        UserPreferenceVector entity = find(userId)
                .map(existing -> {
                    existing.setVector(vector);
                    existing.setSourceText(text);
                    existing.setUpdatedAt(now);
                    return existing;
                })
                .orElseGet(() -> new UserPreferenceVector(userId, vector, text, now));

        UserPreferenceVector saved = withStore("save preference vector", () -> vectorRepository.save(entity));
        log.debug("Stored preference vector for user {} ({} dimensions)", userId, vector.length);
        return saved;
    }

    /**
     * Whether the stored vector is old enough for engagement to trigger a recompute.
     * Users without a vector are due.
     */
    public boolean isRefreshDue(String userId) {
        return find(userId)
                .map(v -> v.getUpdatedAt() == null
                        || !v.getUpdatedAt().plus(learning.getPreferenceRefreshInterval()).isAfter(clock.instant()))
                .orElse(true);
    }

    public long count() {
        return withStore("count preference vectors", vectorRepository::count);
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
