package com.adlanda.recommender.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * An opportunity (scholarship, grant, programme) as held by the catalog.
 *
 * The catalog owns these records; the recommender only reads them.
 *
 * @param id           Stable catalog key
 * @param title        Display title
 * @param summary      Short summary
 * @param description  Long description
 * @param category     Category label used for interest tallies
 * @param provider     Organisation offering the opportunity
 * @param location     Where the opportunity applies
 * @param deadline     Application deadline, may be null
 * @param requirements Eligibility requirements
 * @param benefits     What the opportunity offers
 * @param createdAt    When the item entered the catalog (drives "most recent" ordering)
 */
public record CatalogItem(
        String id,
        String title,
        String summary,
        String description,
        String category,
        String provider,
        String location,
        LocalDate deadline,
        String requirements,
        String benefits,
        Instant createdAt
) {
    static final int SUMMARY_FALLBACK_LENGTH = 500;

    /**
     * Snapshot of the fields kept next to the vector, tagged with the hash of the
     * embedding input it was built from.
     */
    public ItemMetadata toMetadata(String contentHash) {
        return new ItemMetadata(title, displaySummary(), category, provider, location, deadline, contentHash);
    }

    /**
     * The summary, or the first {@value #SUMMARY_FALLBACK_LENGTH} characters of
     * the description when there is none.
     */
    public String displaySummary() {
        if (summary != null && !summary.isBlank()) {
            return summary;
        }
        if (description == null) {
            return null;
        }
        return description.length() > SUMMARY_FALLBACK_LENGTH
                ? description.substring(0, SUMMARY_FALLBACK_LENGTH)
                : description;
    }
}
