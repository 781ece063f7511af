package com.example.storyextractor.domain.model;

import java.util.List;

/**
 * Domain DTO returned from {@code StoryExtractionService} to controllers so UI code can be kept presentation-only.
 */
public record StoryExtractionResult(
        String fileName,
        String module,
        List<StoryRow> stories,
        List<AcceptanceCriterionRow> acceptanceCriteria,
        ExtractionSummary summary
) {

    /**
     * Wraps the extracted tables for a named document.
     *
     * @param fileName display name of the source document
     * @param tables   tables produced by the extraction core
     * @return result including the computed summary
     */
    public static StoryExtractionResult of(String fileName, RequirementsTables tables) {
        return new StoryExtractionResult(
                fileName,
                tables.module(),
                tables.stories(),
                tables.acceptanceCriteria(),
                ExtractionSummary.of(tables.stories(), tables.acceptanceCriteria())
        );
    }

    public boolean isEmpty() {
        return stories.isEmpty() && acceptanceCriteria.isEmpty();
    }
}
