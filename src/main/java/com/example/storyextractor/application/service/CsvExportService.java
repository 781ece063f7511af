package com.example.storyextractor.application.service;

import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.StoryRow;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns the result tables into CSV content.
 * Output depends only on the rows, so equal tables always give equal text.
 */
@Service
public class CsvExportService {

    /**
     * @param rows story rows to export, may be empty
     * @return CSV document including the header row
     */
    public String exportStories(List<StoryRow> rows) {
        StringBuilder builder = new StringBuilder();
        appendLine(builder, StoryRow.COLUMNS);
        for (StoryRow row : rows) {
            appendLine(builder, row.values());
        }
        return builder.toString();
    }

    /**
     * @param rows AC rows to export, may be empty
     * @return CSV document including the header row
     */
    public String exportAcceptanceCriteria(List<AcceptanceCriterionRow> rows) {
        StringBuilder builder = new StringBuilder();
        appendLine(builder, AcceptanceCriterionRow.COLUMNS);
        for (AcceptanceCriterionRow row : rows) {
            appendLine(builder, row.values());
        }
        return builder.toString();
    }

    private void appendLine(StringBuilder builder, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(escape(values.get(i)));
        }
        builder.append('\n');
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or line breaks.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
