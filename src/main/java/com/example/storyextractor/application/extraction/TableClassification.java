package com.example.storyextractor.application.extraction;

/**
 * Outcome of probing a table for acceptance criteria headers.
 *
 * @param acceptanceTable {@code true} when one of the first two rows carries AC keywords
 * @param headerRowIndex  index of the matching header row, {@code null} for other tables
 */
public record TableClassification(boolean acceptanceTable, Integer headerRowIndex) {

    private static final TableClassification NOT_ACCEPTANCE_TABLE = new TableClassification(false, null);

    public static TableClassification notAcceptanceTable() {
        return NOT_ACCEPTANCE_TABLE;
    }

    public static TableClassification headerAt(int rowIndex) {
        return new TableClassification(true, rowIndex);
    }
}
