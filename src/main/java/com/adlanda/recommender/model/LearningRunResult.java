package com.adlanda.recommender.model;

import java.util.List;

/**
 * Summary of one learning loop pass.
 *
 * @param eventsSelected  Unprocessed events picked up
 * @param eventsProcessed Events durably handled and acknowledged
 * @param ratingsInWindow Ratings counted for the helpful ratio
 * @param usersRefreshed  Users whose preference vector was recomputed
 * @param config          Configuration in effect after the pass
 * @param errors          Failures that were caught and logged
 */
public record LearningRunResult(
        int eventsSelected,
        int eventsProcessed,
        long ratingsInWindow,
        int usersRefreshed,
        RecommendationConfig config,
        List<String> errors
) {
}
