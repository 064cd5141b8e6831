package com.adlanda.recommender.service;

import com.adlanda.recommender.entity.CategoryInterest;
import com.adlanda.recommender.model.CatalogItem;
import com.adlanda.recommender.model.UserProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the text that gets embedded for catalog items and user profiles.
 *
 * Blank fields are skipped and the rest joined by a single space, so an item
 * or profile with nothing to say yields an empty string.
 */
@Component
public class EmbeddingTextBuilder {

    /**
     * Profile attributes used for the preference text, in order.
     */
    static final List<String> PROFILE_FIELDS = List.of(
            "educationLevel",
            "careerInterests",
            "learningStyle",
            "timeAvailability",
            "currentSkills",
            "careerGoals",
            "preferredLocations",
            "industries",
            "workExperience",
            "personalityTraits"
    );

    public String forItem(CatalogItem item) {
        return join(List.of(
                nullToEmpty(item.title()),
                nullToEmpty(item.summary()),
                nullToEmpty(item.description()),
                nullToEmpty(item.category()),
                nullToEmpty(item.provider()),
                nullToEmpty(item.location()),
                nullToEmpty(item.requirements()),
                nullToEmpty(item.benefits())));
    }

    public String forProfile(UserProfile profile) {
        return forProfile(profile, List.of());
    }

    /**
     * Profile text followed by the strongest category interests, e.g.
     * {@code "Undergraduate Technology Nigeria Engineering (3 interactions)"}.
     *
     * @param topInterests Interests ordered by weight, strongest first
     */
    public String forProfile(UserProfile profile, List<CategoryInterest> topInterests) {
        Map<String, Object> preferences = profile.preferences() != null ? profile.preferences() : Map.of();

        List<String> parts = new ArrayList<>();
        for (String field : PROFILE_FIELDS) {
            parts.add(render(preferences.get(field)));
        }
        for (CategoryInterest interest : topInterests) {
            if (interest.getWeight() > 0) {
                parts.add(interest.getCategory() + " (" + Math.round(interest.getWeight()) + " interactions)");
            }
        }
        return join(parts);
    }

    private static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .filter(s -> !s.isBlank())
                    .map(String::trim)
                    .collect(Collectors.joining(" "));
        }
        return value.toString();
    }

    private static String join(List<String> parts) {
        return parts.stream()
                .filter(s -> !s.isBlank())
                .map(String::trim)
                .collect(Collectors.joining(" "));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
