package com.example.storyextractor.domain.model;

/**
 * Filter selected on the UI for the result tables. Blank values and the {@code "All"} option disable a criterion.
 *
 * @param epic    exact Epic label
 * @param storyId exact Story ID, only applied to the Acceptance Criteria table
 * @param keyword case-insensitive substring
 */
public record ResultFilter(String epic, String storyId, String keyword) {

    public static final String ALL = "All";

    public ResultFilter {
        epic = normalize(epic);
        storyId = normalize(storyId);
        keyword = keyword == null || keyword.isBlank() ? null : keyword.trim();
    }

    public static ResultFilter none() {
        return new ResultFilter(null, null, null);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank() || ALL.equals(value.trim())) {
            return null;
        }
        return value.trim();
    }
}
