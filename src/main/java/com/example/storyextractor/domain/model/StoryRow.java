package com.example.storyextractor.domain.model;

import java.util.List;

/**
 * Row of the Stories output table. Duplicate story IDs are legal and appear as separate rows.
 */
public record StoryRow(
        String module,
        String epic,
        String storyId,
        String storyTitle,
        int acceptanceCriteriaCount
) {

    public static final List<String> COLUMNS =
            List.of("Module", "Epic", "Story ID", "Story Title", "Acceptance Criteria Count");

    /**
     * @return cell values in {@link #COLUMNS} order
     */
    public List<String> values() {
        return List.of(module, epic, storyId, storyTitle, String.valueOf(acceptanceCriteriaCount));
    }
}
