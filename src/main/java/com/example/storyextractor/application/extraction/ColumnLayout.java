package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.TableRow;

/**
 * Column positions resolved for one AC table. Any index may be {@code null} when the column could not be found.
 *
 * @param acNumberColumn     column holding the AC identifier
 * @param scenarioColumn     column headed "Scenario"
 * @param freeCriteriaColumn column headed "Acceptance Criteria", used when there is no scenario column
 */
public record ColumnLayout(Integer acNumberColumn, Integer scenarioColumn, Integer freeCriteriaColumn) {

    /**
     * @param row data row
     * @return trimmed AC identifier or an empty string
     */
    public String acNumberOf(TableRow row) {
        if (acNumberColumn != null && acNumberColumn < row.size()) {
            return row.cellText(acNumberColumn);
        }
        return "";
    }

    /**
     * Reads the scenario text, falling back to the free-text criteria column.
     *
     * @param row data row
     * @return trimmed scenario text or an empty string
     */
    public String scenarioOf(TableRow row) {
        if (scenarioColumn != null && scenarioColumn < row.size()) {
            return row.cellText(scenarioColumn);
        }
        if (freeCriteriaColumn != null && freeCriteriaColumn < row.size()) {
            return row.cellText(freeCriteriaColumn);
        }
        return "";
    }
}
