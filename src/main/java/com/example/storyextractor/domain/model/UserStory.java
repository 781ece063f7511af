package com.example.storyextractor.domain.model;

/**
 * Mutable story record created for every story heading found while walking a document.
 * The acceptance criteria count grows as AC tables owned by the story are processed.
 */
public final class UserStory {

    private final String module;
    private final String epic;
    private final String storyId;
    private final String storyTitle;
    private int acceptanceCriteriaCount;

    public UserStory(String module, String epic, String storyId, String storyTitle) {
        this.module = module;
        this.epic = epic;
        this.storyId = storyId;
        this.storyTitle = storyTitle;
    }

    /**
     * Adds the number of non-blank data rows of an AC table to this story.
     *
     * @param rows non-negative row count
     */
    public void addAcceptanceCriteria(int rows) {
        if (rows < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + rows);
        }
        acceptanceCriteriaCount += rows;
    }

    /**
     * Builds an AC row carrying this story's identity fields.
     *
     * @param acNumber AC identifier, possibly empty
     * @param scenario scenario or criteria text, possibly empty
     * @return denormalized AC row
     */
    public AcceptanceCriterionRow criterion(String acNumber, String scenario) {
        return new AcceptanceCriterionRow(module, epic, storyId, storyTitle, acNumber, scenario);
    }

    /**
     * @return immutable snapshot used in the Stories output table
     */
    public StoryRow toRow() {
        return new StoryRow(module, epic, storyId, storyTitle, acceptanceCriteriaCount);
    }

    public String getStoryId() {
        return storyId;
    }
}
