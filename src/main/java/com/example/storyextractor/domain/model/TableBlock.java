package com.example.storyextractor.domain.model;

import java.util.List;

/**
 * Domain DTO for a document table. Rows keep their document order and may have differing cell counts
 * when the source table uses merged cells.
 */
public record TableBlock(List<TableRow> rows) implements DocumentBlock {

    public TableBlock {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * Convenience factory used by readers and tests.
     *
     * @param rows table rows in document order
     * @return table wrapping the given rows
     */
    public static TableBlock of(TableRow... rows) {
        return new TableBlock(List.of(rows));
    }

    public int rowCount() {
        return rows.size();
    }

    public TableRow row(int index) {
        return rows.get(index);
    }
}
