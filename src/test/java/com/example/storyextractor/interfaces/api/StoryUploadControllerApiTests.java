package com.example.storyextractor.interfaces.api;

import com.example.storyextractor.application.exception.ExportValidationException;
import com.example.storyextractor.application.service.ResultFilterService;
import com.example.storyextractor.application.service.StoryExtractionService;
import com.example.storyextractor.application.service.TableExportService;
import com.example.storyextractor.domain.exception.DocumentFileRequiredException;
import com.example.storyextractor.domain.exception.UnsupportedDocumentFormatException;
import com.example.storyextractor.domain.model.AcceptanceCriterionRow;
import com.example.storyextractor.domain.model.ExportFormat;
import com.example.storyextractor.domain.model.ExportedFile;
import com.example.storyextractor.domain.model.RequirementsTables;
import com.example.storyextractor.domain.model.ResultFilter;
import com.example.storyextractor.domain.model.StoryExtractionResult;
import com.example.storyextractor.domain.model.StoryRow;
import com.example.storyextractor.infrastructure.exception.DocumentProcessingException;
import com.example.storyextractor.infrastructure.exception.ExportWriteException;
import com.example.storyextractor.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.model;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = StoryUploadController.class)
@Import(GlobalExceptionHandler.class)
class StoryUploadControllerApiTests {

    private static final String DOCX_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StoryExtractionService extractionService;

    @MockBean
    private ResultFilterService filterService;

    @MockBean
    private TableExportService exportService;

    @Test
    void apiExtractReturnsBothTables() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "billing.docx", DOCX_TYPE, "data".getBytes());
        StoryExtractionResult result = StoryExtractionResult.of("billing.docx", new RequirementsTables(
                "Billing",
                List.of(new StoryRow("Billing", "1: Payments", "1.1", "Refund flow", 1)),
                List.of(new AcceptanceCriterionRow("Billing", "1: Payments", "1.1", "Refund flow", "", "Refund succeeds"))));
        BDDMockito.given(extractionService.extract(any(MultipartFile.class))).willReturn(result);

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.module").value("Billing"))
                .andExpect(jsonPath("$.stories[0].storyId").value("1.1"))
                .andExpect(jsonPath("$.stories[0].acceptanceCriteriaCount").value(1))
                .andExpect(jsonPath("$.acceptanceCriteria[0].acNumber").value(""))
                .andExpect(jsonPath("$.summary.totalStories").value(1));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "data".getBytes());
        BDDMockito.given(extractionService.extract(any(MultipartFile.class)))
                .willThrow(new UnsupportedDocumentFormatException("notes.txt"));

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "broken.docx", DOCX_TYPE, "data".getBytes());
        BDDMockito.given(extractionService.extract(any(MultipartFile.class)))
                .willThrow(new DocumentProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/extract").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies that export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void exportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(exportService.exportStories(any(), any(), any()))
                .willThrow(new ExportValidationException("Upload a document before exporting."));

        mockMvc.perform(get("/export/stories"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("EXPORT_VALIDATION_ERROR"));
    }

    @Test
    void workbookWriteFailureMappedToServerError() throws Exception {
        BDDMockito.given(exportService.exportStories(any(), any(), eq(ExportFormat.XLSX)))
                .willThrow(new ExportWriteException("Unable to write the Stories workbook.", new IOException("disk")));

        mockMvc.perform(get("/export/stories").param("format", "xlsx"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"))
                .andExpect(jsonPath("$.message").value("Unable to write the Stories workbook."));
    }

    @Test
    void exportStreamsFileAsAttachment() throws Exception {
        BDDMockito.given(exportService.exportAcceptanceCriteria(any(), any(ResultFilter.class), eq(ExportFormat.CSV)))
                .willReturn(new ExportedFile("acceptance_criteria.csv", "text/csv",
                        "Module,Epic\n".getBytes(StandardCharsets.UTF_8)));

        mockMvc.perform(get("/export/acceptance-criteria").param("format", "csv").param("storyId", "1.1"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("acceptance_criteria.csv")))
                .andExpect(content().contentType("text/csv"))
                .andExpect(content().string("Module,Epic\n"));
    }

    @Test
    void uploadFormShowsDomainErrorInline() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", new byte[0]);
        BDDMockito.given(extractionService.extract(any(MultipartFile.class)))
                .willThrow(new DocumentFileRequiredException());

        mockMvc.perform(multipart("/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(view().name("upload"))
                .andExpect(model().attribute("error", "Please choose a Word document to upload."));
    }

    @Test
    void uploadFormShowsNoticeForEmptyResult() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.docx", DOCX_TYPE, "data".getBytes());
        BDDMockito.given(extractionService.extract(any(MultipartFile.class)))
                .willReturn(StoryExtractionResult.of("empty.docx", RequirementsTables.empty()));

        mockMvc.perform(multipart("/extract").file(file))
                .andExpect(status().isOk())
                .andExpect(model().attribute("notice", StoryUploadController.NO_DATA_NOTICE));
    }
}
