package com.example.storyextractor.domain.model;

import java.util.List;

/**
 * Row of the Acceptance Criteria output table. Story identity is copied into every row.
 */
public record AcceptanceCriterionRow(
        String module,
        String epic,
        String storyId,
        String storyTitle,
        String acNumber,
        String scenario
) {

    public static final List<String> COLUMNS =
            List.of("Module", "Epic", "Story ID", "Story Title", "AC #", "Scenario");

    /**
     * @return cell values in {@link #COLUMNS} order
     */
    public List<String> values() {
        return List.of(module, epic, storyId, storyTitle, acNumber, scenario);
    }
}
