package com.example.storyextractor.application.service;

import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.ResultFilter;
import com.example.storyextractor.domain.model.StoryRow;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Application-layer service that narrows the result tables to the rows selected on the UI.
 */
@Service
public class ResultFilterService {

    /**
     * Filters stories by exact Epic and by keyword contained in the Story Title.
     *
     * @param stories story rows
     * @param filter  UI selection
     * @return matching rows in their original order
     */
    public List<StoryRow> filterStories(List<StoryRow> stories, ResultFilter filter) {
        if (stories == null) {
            return List.of();
        }
        ResultFilter criteria = filter == null ? ResultFilter.none() : filter;
        return stories.stream()
                .filter(row -> criteria.epic() == null || criteria.epic().equals(row.epic()))
                .filter(row -> criteria.keyword() == null || containsIgnoreCase(row.storyTitle(), criteria.keyword()))
                .toList();
    }

    /**
     * Filters AC rows by exact Epic, exact Story ID and keyword contained in the Scenario or AC #.
     *
     * @param rows   AC rows
     * @param filter UI selection
     * @return matching rows in their original order
     */
    public List<AcceptanceCriterionRow> filterAcceptanceCriteria(List<AcceptanceCriterionRow> rows, ResultFilter filter) {
        if (rows == null) {
            return List.of();
        }
        ResultFilter criteria = filter == null ? ResultFilter.none() : filter;
        return rows.stream()
                .filter(row -> criteria.epic() == null || criteria.epic().equals(row.epic()))
                .filter(row -> criteria.storyId() == null || criteria.storyId().equals(row.storyId()))
                .filter(row -> criteria.keyword() == null
                        || containsIgnoreCase(row.scenario(), criteria.keyword())
                        || containsIgnoreCase(row.acNumber(), criteria.keyword()))
                .toList();
    }

    /**
     * @param stories story rows
     * @return sorted distinct Epic labels for the filter drop-down
     */
    public List<String> epicOptions(List<StoryRow> stories) {
        if (stories == null) {
            return List.of();
        }
        return stories.stream().map(StoryRow::epic).filter(Objects::nonNull).distinct().sorted().toList();
    }

    /**
     * @param rows AC rows
     * @return sorted distinct Epic labels present in the AC rows
     */
    public List<String> criteriaEpicOptions(List<AcceptanceCriterionRow> rows) {
        if (rows == null) {
            return List.of();
        }
        return rows.stream().map(AcceptanceCriterionRow::epic).filter(Objects::nonNull).distinct().sorted().toList();
    }

    /**
     * @param rows AC rows
     * @param epic selected Epic, {@code null} or "All" for every epic
     * @return sorted distinct Story IDs present in the AC rows of the epic
     */
    public List<String> storyIdOptions(List<AcceptanceCriterionRow> rows, String epic) {
        if (rows == null) {
            return List.of();
        }
        ResultFilter scope = new ResultFilter(epic, null, null);
        return rows.stream()
                .filter(row -> scope.epic() == null || scope.epic().equals(row.epic()))
                .map(AcceptanceCriterionRow::storyId)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    private boolean containsIgnoreCase(String value, String keyword) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }
}
