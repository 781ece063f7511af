package com.example.storyextractor.application.service;

import com.example.storyextractor.application.exception.ExportValidationException;
import com.example.storyextractor.config.StoryExtractorProperties;
import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.ExportFormat;
import com.example.storyextractor.domain.model.ExportedFile;
import com.example.storyextractor.domain.model.ResultFilter;
import com.example.storyextractor.domain.model.StoryExtractionResult;
import com.example.storyextractor.domain.model.StoryRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Application-layer service behind the download buttons: validates the cached result, applies the UI filter
 * and renders the selected table in the requested format.
 */
@Service
public class TableExportService {

    private static final Logger log = LoggerFactory.getLogger(TableExportService.class);
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final ResultFilterService filterService;
    private final CsvExportService csvExportService;
    private final ExcelExportService excelExportService;
    private final StoryExtractorProperties.Export exportProperties;

    public TableExportService(ResultFilterService filterService,
                              CsvExportService csvExportService,
                              ExcelExportService excelExportService,
                              StoryExtractorProperties properties) {
        this.filterService = filterService;
        this.csvExportService = csvExportService;
        this.excelExportService = excelExportService;
        this.exportProperties = properties.export();
    }

    /**
     * Exports the filtered Stories table.
     *
     * @param result cached extraction result stored in the session
     * @param filter UI filter; only Epic and keyword apply
     * @param format requested download format
     * @return file ready to stream to the browser
     * @throws ExportValidationException when there is no result to export
     */
    public ExportedFile exportStories(StoryExtractionResult result, ResultFilter filter, ExportFormat format) {
        requireResult(result);
        List<StoryRow> rows = filterService.filterStories(result.stories(), filter);
        log.info("Exporting {} story rows as {}", rows.size(), format);
        byte[] content = format == ExportFormat.XLSX
                ? excelExportService.exportStories(rows)
                : encodeCsv(csvExportService.exportStories(rows));
        return new ExportedFile(exportProperties.storiesFileName() + "." + format.extension(), format.mediaType(), content);
    }

    /**
     * Exports the filtered Acceptance Criteria table.
     *
     * @param result cached extraction result stored in the session
     * @param filter UI filter
     * @param format requested download format
     * @return file ready to stream to the browser
     * @throws ExportValidationException when there is no result to export
     */
    public ExportedFile exportAcceptanceCriteria(StoryExtractionResult result, ResultFilter filter, ExportFormat format) {
        requireResult(result);
        List<AcceptanceCriterionRow> rows = filterService.filterAcceptanceCriteria(result.acceptanceCriteria(), filter);
        log.info("Exporting {} acceptance criteria rows as {}", rows.size(), format);
        byte[] content = format == ExportFormat.XLSX
                ? excelExportService.exportAcceptanceCriteria(rows)
                : encodeCsv(csvExportService.exportAcceptanceCriteria(rows));
        return new ExportedFile(exportProperties.acceptanceCriteriaFileName() + "." + format.extension(), format.mediaType(), content);
    }

    private void requireResult(StoryExtractionResult result) {
        if (result == null) {
            throw new ExportValidationException("Upload a document before exporting.");
        }
    }

    private byte[] encodeCsv(String csv) {
        byte[] body = csv.getBytes(StandardCharsets.UTF_8);
        if (!exportProperties.csvByteOrderMark()) {
            return body;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(UTF8_BOM.length + body.length);
        out.writeBytes(UTF8_BOM);
        out.writeBytes(body);
        return out.toByteArray();
    }
}
