package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.TableBlock;
import com.example.storyextractor.domain.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Identifies the AC number and scenario columns of an acceptance criteria table.
 * Header text is tried first. When no header names the AC number, the column whose sampled values look like
 * dotted integers ({@code 3}, {@code 1.2}, {@code 2.1.1}) is taken instead.
 */
@Component
public class ColumnInferencer {

    private static final Logger log = LoggerFactory.getLogger(ColumnInferencer.class);
    private static final Pattern NUMBER_LIKE = Pattern.compile("\\d+(?:\\.\\d+)*");
    private static final int SAMPLE_ROWS = 6;
    private static final int MIN_NUMBER_HITS = 2;

    private final HeaderCanonicalizer headerCanonicalizer;
    private final DataRowSegmenter rowSegmenter;

    public ColumnInferencer(HeaderCanonicalizer headerCanonicalizer, DataRowSegmenter rowSegmenter) {
        this.headerCanonicalizer = headerCanonicalizer;
        this.rowSegmenter = rowSegmenter;
    }

    /**
     * Resolves the column layout of an AC table.
     *
     * @param table          AC table
     * @param headerRowIndex header row reported by the classifier
     * @return resolved layout; unresolved columns are {@code null}
     */
    public ColumnLayout locateColumns(TableBlock table, int headerRowIndex) {
        List<String> headers = table.row(headerRowIndex).cells().stream()
                .map(headerCanonicalizer::canonicalize)
                .toList();

        Integer acNumberColumn = indexOf(headers, HeaderCanonicalizer.AC_NUMBER);
        Integer scenarioColumn = indexOf(headers, HeaderCanonicalizer.SCENARIO);
        Integer freeCriteriaColumn = indexOf(headers, HeaderCanonicalizer.ACCEPTANCE_CRITERIA);

        if (acNumberColumn == null) {
            acNumberColumn = inferNumberColumn(table, headerRowIndex, headers.size());
        }
        log.debug("Resolved AC table columns headers={} acNumber={} scenario={} criteria={}",
                headers, acNumberColumn, scenarioColumn, freeCriteriaColumn);
        return new ColumnLayout(acNumberColumn, scenarioColumn, freeCriteriaColumn);
    }

    private Integer indexOf(List<String> headers, String canonicalHeader) {
        for (int column = 0; column < headers.size(); column++) {
            if (headers.get(column).equals(canonicalHeader)) {
                return column;
            }
        }
        return null;
    }

    /**
     * Scores every header column by how many of the first sampled data cells are dotted integers.
     * The lowest index wins ties.
     *
     * @param table          AC table
     * @param headerRowIndex header row index
     * @param columnCount    number of header cells
     * @return best scoring column when it has at least two hits, otherwise {@code null}
     */
    private Integer inferNumberColumn(TableBlock table, int headerRowIndex, int columnCount) {
        RowRange range = rowSegmenter.dataRowRange(table, headerRowIndex);
        if (range.isEmpty()) {
            return null;
        }
        int sampleEnd = Math.min(range.end(), range.start() + SAMPLE_ROWS);
        Integer bestColumn = null;
        int bestHits = -1;
        for (int column = 0; column < columnCount; column++) {
            int hits = 0;
            for (int rowIndex = range.start(); rowIndex < sampleEnd; rowIndex++) {
                TableRow row = table.row(rowIndex);
                if (column >= row.size()) {
                    continue;
                }
                String value = row.cellText(column);
                if (!value.isEmpty() && NUMBER_LIKE.matcher(value).matches()) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                bestHits = hits;
                bestColumn = column;
            }
        }
        return bestHits >= MIN_NUMBER_HITS ? bestColumn : null;
    }
}
