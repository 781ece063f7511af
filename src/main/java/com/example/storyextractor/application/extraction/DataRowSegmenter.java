package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.TableBlock;
import org.springframework.stereotype.Component;

/**
 * Locates the data rows that follow an AC table header.
 */
@Component
public class DataRowSegmenter {

    /**
     * Computes the data region below the header. A single blank separator row directly under the header
     * is skipped; further blank rows stay inside the range.
     *
     * @param table          AC table
     * @param headerRowIndex header row reported by the classifier
     * @return data row range, possibly empty
     */
    public RowRange dataRowRange(TableBlock table, int headerRowIndex) {
        int totalRows = table.rowCount();
        int start = headerRowIndex + 1;
        if (start < totalRows && table.row(start).isBlank()) {
            start++;
        }
        return new RowRange(Math.min(start, totalRows), totalRows);
    }

    /**
     * @param table table owning the rows
     * @param range data row range
     * @return number of rows in the range with at least one non-blank cell
     */
    public int countNonBlankRows(TableBlock table, RowRange range) {
        int count = 0;
        for (int rowIndex = range.start(); rowIndex < range.end(); rowIndex++) {
            if (!table.row(rowIndex).isBlank()) {
                count++;
            }
        }
        return count;
    }
}
