package com.example.storyextractor.infrastructure.docx;

import com.example.storyextractor.DocxTestDocuments;
import com.example.storyextractor.domain.model.DocumentBlock;
import com.example.storyextractor.domain.model.ParagraphBlock;
import com.example.storyextractor.domain.model.TableBlock;
import com.example.storyextractor.infrastructure.exception.DocumentProcessingException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PoiDocxBlockReaderTest {

    private final PoiDocxBlockReader reader = new PoiDocxBlockReader();

    @Test
    void readsParagraphsAndTablesInBodyOrder() throws Exception {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph("Story 1: Login")
                .table(new String[]{"AC #", "Scenario"}, new String[]{"1", "Valid"})
                .paragraph("Story 2: Logout")
                .build();

        List<DocumentBlock> blocks = reader.readBlocks(docx);

        assertThat(blocks).hasSize(3);
        assertThat(blocks.get(0)).isEqualTo(new ParagraphBlock("Story 1: Login"));
        assertThat(blocks.get(1)).isInstanceOf(TableBlock.class);
        TableBlock table = (TableBlock) blocks.get(1);
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.row(1).cellText(1)).isEqualTo("Valid");
        assertThat(blocks.get(2)).isEqualTo(new ParagraphBlock("Story 2: Logout"));
    }

    @Test
    void horizontallyMergedCellIsRepeatedForEveryGridColumn() throws Exception {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph("Story 1: Login")
                .table(new String[]{"Description", "", "Scenario"},
                        new String[]{"x", "y", "Login succeeds"})
                .mergeAcross(0, 0, 2)
                .build();

        TableBlock table = (TableBlock) reader.readBlocks(docx).get(1);

        assertThat(table.row(0).cells()).containsExactly("Description", "Description", "Scenario");
        assertThat(table.row(1).cells()).containsExactly("x", "y", "Login succeeds");
    }

    @Test
    void verticallyMergedContinuationTakesTextOfCellAbove() throws Exception {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph("Story 1: Login")
                .table(new String[]{"AC #", "Scenario"},
                        new String[]{"1", "Shared scenario"},
                        new String[]{"2", ""},
                        new String[]{"3", ""})
                .mergeDown(1, 1, 3)
                .build();

        TableBlock table = (TableBlock) reader.readBlocks(docx).get(1);

        assertThat(table.row(2).cellText(1)).isEqualTo("Shared scenario");
        assertThat(table.row(3).cellText(1)).isEqualTo("Shared scenario");
        assertThat(table.row(3).cellText(0)).isEqualTo("3");
    }

    @Test
    void emptyDocumentYieldsNoBlocks() throws Exception {
        assertThat(reader.readBlocks(DocxTestDocuments.builder().build())).isEmpty();
    }

    @Test
    void nonDocxBytesAreRejected() {
        byte[] bytes = "plain text".getBytes(StandardCharsets.UTF_8);

        assertThrows(DocumentProcessingException.class, () -> reader.readBlocks(bytes));
    }
}
