package com.example.storyextractor.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Headline figures shown above the result tables.
 */
public record ExtractionSummary(
        int totalEpics,
        int totalStories,
        int totalAcceptanceCriteria,
        double averageAcceptanceCriteriaPerStory
) {

    /**
     * Computes the summary for a pair of output tables.
     *
     * @param stories            story rows
     * @param acceptanceCriteria AC rows
     * @return summary with the average rounded to two decimals, zero when there are no stories
     */
    public static ExtractionSummary of(List<StoryRow> stories, List<AcceptanceCriterionRow> acceptanceCriteria) {
        int epics = (int) stories.stream().map(StoryRow::epic).filter(Objects::nonNull).distinct().count();
        double average = stories.isEmpty()
                ? 0.0
                : BigDecimal.valueOf(acceptanceCriteria.size())
                .divide(BigDecimal.valueOf(stories.size()), 2, RoundingMode.HALF_UP)
                .doubleValue();
        return new ExtractionSummary(epics, stories.size(), acceptanceCriteria.size(), average);
    }
}
