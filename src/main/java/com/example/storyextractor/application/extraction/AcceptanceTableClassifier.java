package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.TableBlock;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a document table holds acceptance criteria and which row is its header.
 */
@Component
public class AcceptanceTableClassifier {

    private static final List<String> HEADER_KEYWORDS =
            List.of("acceptance", "criteria", "scenario", "given", "when", "then", "expected", "result");
    private static final int MAX_HEADER_PROBE_ROWS = 2;

    /**
     * Inspects row 0 and then row 1; the first row mentioning any AC keyword becomes the header.
     *
     * @param table table to inspect
     * @return classification, never {@code null}
     */
    public TableClassification classify(TableBlock table) {
        for (int rowIndex = 0; rowIndex < MAX_HEADER_PROBE_ROWS; rowIndex++) {
            if (rowIndex >= table.rowCount()) {
                break;
            }
            String rowText = table.row(rowIndex).joinedLowerCase(" | ");
            if (HEADER_KEYWORDS.stream().anyMatch(rowText::contains)) {
                return TableClassification.headerAt(rowIndex);
            }
        }
        return TableClassification.notAcceptanceTable();
    }
}
