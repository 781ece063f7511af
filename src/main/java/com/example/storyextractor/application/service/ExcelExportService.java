package com.example.storyextractor.application.service;

import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.StoryRow;
import com.example.storyextractor.infrastructure.exception.ExportWriteException;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Application-layer service that writes the result tables to a .xlsx workbook with one sheet per table.
 */
@Service
public class ExcelExportService {

    public static final String STORIES_SHEET = "Stories";
    public static final String ACCEPTANCE_CRITERIA_SHEET = "Acceptance Criteria";
    private static final int MIN_COLUMN_CHARS = 8;
    private static final int MAX_COLUMN_CHARS = 80;

    /**
     * @param rows story rows to export, may be empty
     * @return workbook bytes with a "Stories" sheet
     */
    public byte[] exportStories(List<StoryRow> rows) {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(STORIES_SHEET);
            writeHeader(workbook, sheet, StoryRow.COLUMNS);
            int r = 1;
            for (StoryRow story : rows) {
                Row row = sheet.createRow(r++);
                write(row, 0, story.module());
                write(row, 1, story.epic());
                write(row, 2, story.storyId());
                write(row, 3, story.storyTitle());
                row.createCell(4, CellType.NUMERIC).setCellValue(story.acceptanceCriteriaCount());
            }
            return toBytes(workbook, sheet, StoryRow.COLUMNS.size());
        } catch (IOException e) {
            throw new ExportWriteException("Unable to write the Stories workbook.", e);
        }
    }

    /**
     * @param rows AC rows to export, may be empty
     * @return workbook bytes with an "Acceptance Criteria" sheet
     */
    public byte[] exportAcceptanceCriteria(List<AcceptanceCriterionRow> rows) {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(ACCEPTANCE_CRITERIA_SHEET);
            writeHeader(workbook, sheet, AcceptanceCriterionRow.COLUMNS);
            int r = 1;
            for (AcceptanceCriterionRow criterion : rows) {
                Row row = sheet.createRow(r++);
                List<String> values = criterion.values();
                for (int i = 0; i < values.size(); i++) {
                    write(row, i, values.get(i));
                }
            }
            return toBytes(workbook, sheet, AcceptanceCriterionRow.COLUMNS.size());
        } catch (IOException e) {
            throw new ExportWriteException("Unable to write the Acceptance Criteria workbook.", e);
        }
    }

    private void writeHeader(Workbook workbook, Sheet sheet, List<String> columns) {
        Font bold = workbook.createFont();
        bold.setBold(true);
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFont(bold);

        Row header = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) {
            header.createCell(i, CellType.STRING).setCellValue(columns.get(i));
            header.getCell(i).setCellStyle(headerStyle);
        }
    }

    /**
     * Sizes columns from the longest cell text instead of {@code autoSizeColumn}, which needs AWT fonts.
     */
    private byte[] toBytes(Workbook workbook, Sheet sheet, int columnCount) throws IOException {
        int[] widths = new int[columnCount];
        for (Row row : sheet) {
            for (int i = 0; i < columnCount; i++) {
                if (row.getCell(i) != null && row.getCell(i).getCellType() == CellType.STRING) {
                    widths[i] = Math.max(widths[i], row.getCell(i).getStringCellValue().length());
                }
            }
        }
        for (int i = 0; i < columnCount; i++) {
            int characters = Math.min(Math.max(widths[i], MIN_COLUMN_CHARS), MAX_COLUMN_CHARS) + 2;
            sheet.setColumnWidth(i, characters * 256);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        workbook.write(out);
        return out.toByteArray();
    }

    private static void write(Row row, int column, String value) {
        row.createCell(column, CellType.STRING).setCellValue(value == null ? "" : value);
    }
}
