package com.adlanda.recommender.model;

import java.util.List;

/**
 * Result of a recommendation, similarity or search call.
 *
 * @param items    Ranked matches, best first
 * @param degraded True when the result is not a normal personalised ranking;
 *                 consumers should show a disclaimer
 * @param source   How the list was produced
 * @param message  Human readable explanation of the source
 */
public record RankedList(
        List<ScoredItem> items,
        boolean degraded,
        Source source,
        String message
) {
    public enum Source {
        PERSONALIZED,
        RECENT_FALLBACK,
        SIMILAR_ITEMS,
        SEARCH
    }

    public static RankedList personalized(List<ScoredItem> items) {
        return new RankedList(items, false, Source.PERSONALIZED,
                "Personalized recommendations based on your profile");
    }

    public static RankedList recentFallback(List<ScoredItem> items) {
        return new RankedList(items, true, Source.RECENT_FALLBACK,
                "Showing recent opportunities (recommendations will improve as you interact more)");
    }

    public static RankedList similar(List<ScoredItem> items) {
        return new RankedList(items, false, Source.SIMILAR_ITEMS, "Similar opportunities");
    }

    public static RankedList search(List<ScoredItem> items) {
        return new RankedList(items, false, Source.SEARCH, "Search results");
    }

    public boolean isFallback() {
        return source == Source.RECENT_FALLBACK;
    }

    public int size() {
        return items.size();
    }
}
