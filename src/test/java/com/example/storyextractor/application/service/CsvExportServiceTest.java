package com.example.storyextractor.application.service;

import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.StoryRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests verifying the CSV rendering of both output tables.
 */
class CsvExportServiceTest {

    private final CsvExportService service = new CsvExportService();

    @Test
    void emptyStoriesExportHasOnlyHeader() {
        assertThat(service.exportStories(List.of()))
                .isEqualTo("Module,Epic,Story ID,Story Title,Acceptance Criteria Count\n");
    }

    @Test
    void storiesExportWritesCountsAndQuotesCommas() {
        String csv = service.exportStories(List.of(
                new StoryRow("Billing", "1: Payments", "1.1", "Refund, partial", 3)));

        assertThat(csv).endsWith("Billing,1: Payments,1.1,\"Refund, partial\",3\n");
    }

    @Test
    void acceptanceCriteriaExportEscapesQuotesAndLineBreaks() {
        String csv = service.exportAcceptanceCriteria(List.of(
                new AcceptanceCriterionRow("Billing", "1: Payments", "1.1", "Refund", "", "User sees \"Done\"\nand a receipt")));

        assertThat(csv).startsWith("Module,Epic,Story ID,Story Title,AC #,Scenario\n");
        assertThat(csv).contains("Billing,1: Payments,1.1,Refund,,\"User sees \"\"Done\"\"\nand a receipt\"\n");
    }

    @Test
    void exportIsDeterministic() {
        List<StoryRow> rows = List.of(new StoryRow("M", "E", "1", "T", 1));

        assertThat(service.exportStories(rows)).isEqualTo(service.exportStories(List.copyOf(rows)));
    }
}
