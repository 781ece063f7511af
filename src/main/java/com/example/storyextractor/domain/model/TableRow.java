package com.example.storyextractor.domain.model;

import com.example.storyextractor.domain.text.UnicodeText;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Domain DTO describing one row of a document table as the raw text of each cell.
 */
public record TableRow(List<String> cells) {

    public TableRow {
        cells = cells == null
                ? List.of()
                : cells.stream().map(cell -> cell == null ? "" : cell).toList();
    }

    /**
     * Convenience factory used by readers and tests.
     *
     * @param cells cell texts in column order
     * @return row wrapping the given cells
     */
    public static TableRow of(String... cells) {
        return new TableRow(List.of(cells));
    }

    /**
     * @return number of cells in the row
     */
    public int size() {
        return cells.size();
    }

    /**
     * Returns the trimmed text of a cell.
     *
     * @param column zero based column index
     * @return trimmed text, or an empty string when the row has no such cell
     */
    public String cellText(int column) {
        if (column < 0 || column >= cells.size()) {
            return "";
        }
        return UnicodeText.strip(cells.get(column));
    }

    /**
     * A row is blank when every cell is empty after trimming. Rows without cells are blank.
     *
     * @return {@code true} for separator rows
     */
    public boolean isBlank() {
        return cells.stream().allMatch(UnicodeText::isBlank);
    }

    /**
     * Joins the lowercase trimmed cell texts, used for keyword probing of header rows.
     *
     * @param separator text placed between cells
     * @return flattened row text
     */
    public String joinedLowerCase(String separator) {
        return cells.stream()
                .map(cell -> UnicodeText.strip(cell).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(separator));
    }
}
