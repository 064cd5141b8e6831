package com.adlanda.recommender.service;

import com.adlanda.recommender.config.RecommenderProperties;
import com.adlanda.recommender.exception.RateLimitExceededException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-user fixed-window request counter.
 *
 * A user's window opens with their first request and the counter expires with
 * it. The number of tracked users is bounded. Counts are in memory only.
 */
@Component
public class RequestRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RequestRateLimiter.class);

    private final int limit;
    private final Cache<String, AtomicInteger> counters;

    @Autowired
    public RequestRateLimiter(RecommenderProperties properties) {
        this(properties.getRateLimit(), Ticker.systemTicker());
    }

    RequestRateLimiter(RecommenderProperties.RateLimit config, Ticker ticker) {
        this.limit = config.getRequestsPerWindow();
        this.counters = Caffeine.newBuilder()
                .expireAfterWrite(config.getWindow())
                .maximumSize(config.getMaxTrackedUsers())
                .ticker(ticker)
                .build();
    }

    /**
     * Counts a request for {@code userId}.
     *
     * @return false if the user is over the limit for the current window
     */
    public boolean tryAcquire(String userId) {
        int count = counters.get(userId, key -> new AtomicInteger()).incrementAndGet();
        return count <= limit;
    }

    /**
     * @throws RateLimitExceededException if the user is over the limit
     */
    public void checkAllowed(String userId) {
        if (!tryAcquire(userId)) {
            log.warn("Rate limit exceeded for user {}", userId);
            throw new RateLimitExceededException(userId);
        }
    }

    long trackedUsers() {
        counters.cleanUp();
        return counters.estimatedSize();
    }
}
