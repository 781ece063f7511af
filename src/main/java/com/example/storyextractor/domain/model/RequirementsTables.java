package com.example.storyextractor.domain.model;

import java.util.List;

/**
 * The two tables produced by walking one document.
 *
 * @param module             document wide module name, {@code "Unknown"} when absent
 * @param stories            story rows in creation order
 * @param acceptanceCriteria AC rows in document order
 */
public record RequirementsTables(
        String module,
        List<StoryRow> stories,
        List<AcceptanceCriterionRow> acceptanceCriteria
) {

    public static final String UNKNOWN = "Unknown";

    public RequirementsTables {
        stories = stories == null ? List.of() : List.copyOf(stories);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
    }

    public static RequirementsTables empty() {
        return new RequirementsTables(UNKNOWN, List.of(), List.of());
    }

    public boolean isEmpty() {
        return stories.isEmpty() && acceptanceCriteria.isEmpty();
    }
}
