package com.adlanda.recommender.model;

import java.time.LocalDate;

/**
 * Catalog fields stored alongside an embedding so results can be rendered and
 * filtered without a join against the catalog.
 *
 * @param contentHash SHA-256 of the embedding input; used to detect edited items
 */
public record ItemMetadata(
        String title,
        String summary,
        String category,
        String provider,
        String location,
        LocalDate deadline,
        String contentHash
) {
}
