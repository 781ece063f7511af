package com.example.storyextractor.application.service;

import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.StoryRow;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExcelExportServiceTest {

    private final ExcelExportService service = new ExcelExportService();

    @Test
    void storiesWorkbookHasHeaderAndNumericCount() throws Exception {
        byte[] bytes = service.exportStories(List.of(new StoryRow("Billing", "1: Payments", "1.1", "Refund flow", 2)));

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet(ExcelExportService.STORIES_SHEET);
            assertThat(sheet).isNotNull();
            assertThat(sheet.getRow(0).getCell(4).getStringCellValue()).isEqualTo("Acceptance Criteria Count");
            assertThat(sheet.getRow(1).getCell(2).getStringCellValue()).isEqualTo("1.1");
            assertThat(sheet.getRow(1).getCell(4).getCellType()).isEqualTo(CellType.NUMERIC);
            assertThat(sheet.getRow(1).getCell(4).getNumericCellValue()).isEqualTo(2.0);
        }
    }

    @Test
    void emptyAcceptanceCriteriaWorkbookHasOnlyHeader() throws Exception {
        byte[] bytes = service.exportAcceptanceCriteria(List.<AcceptanceCriterionRow>of());

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet(ExcelExportService.ACCEPTANCE_CRITERIA_SHEET);
            assertThat(sheet.getLastRowNum()).isZero();
            assertThat(sheet.getRow(0).getCell(4).getStringCellValue()).isEqualTo("AC #");
        }
    }
}
