package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.RequirementsTables;
import com.example.storyextractor.domain.model.UserStory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects stories and AC rows for a single extraction run. Not thread-safe; create one per document.
 */
class StoryAggregator {

    private final List<UserStory> stories = new ArrayList<>();
    private final List<AcceptanceCriterionRow> acceptanceCriteria = new ArrayList<>();

    void addStory(UserStory story) {
        stories.add(story);
    }

    void addAcceptanceCriterion(AcceptanceCriterionRow row) {
        acceptanceCriteria.add(row);
    }

    /**
     * @param module module name shared by every row
     * @return immutable output tables in creation order
     */
    RequirementsTables toTables(String module) {
        return new RequirementsTables(
                module,
                stories.stream().map(UserStory::toRow).toList(),
                acceptanceCriteria
        );
    }
}
