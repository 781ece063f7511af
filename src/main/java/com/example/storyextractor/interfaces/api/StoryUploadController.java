package com.example.storyextractor.interfaces.api;

import com.example.storyextractor.application.exception.ApplicationException;
import com.example.storyextractor.application.service.ResultFilterService;
import com.example.storyextractor.application.service.StoryExtractionService;
import com.example.storyextractor.application.service.TableExportService;
import com.example.storyextractor.domain.exception.DomainException;
import com.example.storyextractor.domain.model.ExportFormat;
import com.example.storyextractor.domain.model.ExportedFile;
import com.example.storyextractor.domain.model.ResultFilter;
import com.example.storyextractor.domain.model.StoryExtractionResult;
import com.example.storyextractor.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer MVC controller that handles Word document uploads, result filtering and table downloads.
 */
@Controller
public class StoryUploadController {

    private static final Logger log = LoggerFactory.getLogger(StoryUploadController.class);
    private static final String SESSION_RESULT_KEY = "LATEST_STORY_RESULT";
    static final String NO_DATA_NOTICE = "No user stories or acceptance criteria found in the document.";

    private final StoryExtractionService extractionService;
    private final ResultFilterService filterService;
    private final TableExportService exportService;

    public StoryUploadController(StoryExtractionService extractionService,
                                 ResultFilterService filterService,
                                 TableExportService exportService) {
        this.extractionService = extractionService;
        this.filterService = filterService;
        this.exportService = exportService;
    }

    /**
     * Renders the upload page with the cached session result narrowed by the filter parameters.
     *
     * @param epic          Epic filter of the Stories tab
     * @param keyword       Story Title search of the Stories tab
     * @param acEpic        Epic filter of the Acceptance Criteria tab
     * @param acStoryId     Story ID filter of the Acceptance Criteria tab
     * @param acKeyword     Scenario / AC # search of the Acceptance Criteria tab
     * @param model         model used to expose attributes to the Thymeleaf view
     * @param session       HTTP session storing the last extraction result
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(@RequestParam(value = "epic", required = false) String epic,
                                 @RequestParam(value = "keyword", required = false) String keyword,
                                 @RequestParam(value = "acEpic", required = false) String acEpic,
                                 @RequestParam(value = "acStoryId", required = false) String acStoryId,
                                 @RequestParam(value = "acKeyword", required = false) String acKeyword,
                                 Model model,
                                 HttpSession session) {
        StoryExtractionResult result = (StoryExtractionResult) session.getAttribute(SESSION_RESULT_KEY);
        populateResult(model, result,
                new ResultFilter(epic, null, keyword),
                new ResultFilter(acEpic, acStoryId, acKeyword));
        model.addAttribute("error", null);
        return "upload";
    }

    /**
     * Handles form submissions for story extraction.
     *
     * @param file    uploaded .docx document
     * @param model   model used for view rendering
     * @param session HTTP session for caching the result
     * @return upload view name populated with success or error data
     */
    @PostMapping("/extract")
    public String handleUpload(@RequestParam("file") MultipartFile file, Model model, HttpSession session) {
        try {
            StoryExtractionResult result = extractionService.extract(file);
            session.setAttribute(SESSION_RESULT_KEY, result);
            populateResult(model, result, ResultFilter.none(), ResultFilter.none());
            model.addAttribute("error", null);
        } catch (DomainException | ApplicationException ex) {
            populateResult(model, null, ResultFilter.none(), ResultFilter.none());
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            log.warn("Could not read uploaded document {}", file.getOriginalFilename(), ex);
            populateResult(model, null, ResultFilter.none(), ResultFilter.none());
            model.addAttribute("error", "We couldn't read that document. Please try another .docx file.");
        }
        return "upload";
    }

    /**
     * REST endpoint that mirrors the HTML upload form but returns JSON.
     *
     * @param file uploaded .docx document
     * @return JSON response containing both result tables and the summary
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<StoryExtractionResult> handleUploadApi(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(extractionService.extract(file));
    }

    /**
     * Downloads the filtered Stories table.
     */
    @GetMapping("/export/stories")
    public ResponseEntity<byte[]> exportStories(@RequestParam(value = "format", required = false) String format,
                                                @RequestParam(value = "epic", required = false) String epic,
                                                @RequestParam(value = "keyword", required = false) String keyword,
                                                HttpSession session) {
        StoryExtractionResult cached = (StoryExtractionResult) session.getAttribute(SESSION_RESULT_KEY);
        ExportedFile file = exportService.exportStories(
                cached, new ResultFilter(epic, null, keyword), ExportFormat.fromString(format));
        return download(file);
    }

    /**
     * Downloads the filtered Acceptance Criteria table.
     */
    @GetMapping("/export/acceptance-criteria")
    public ResponseEntity<byte[]> exportAcceptanceCriteria(@RequestParam(value = "format", required = false) String format,
                                                           @RequestParam(value = "epic", required = false) String epic,
                                                           @RequestParam(value = "storyId", required = false) String storyId,
                                                           @RequestParam(value = "keyword", required = false) String keyword,
                                                           HttpSession session) {
        StoryExtractionResult cached = (StoryExtractionResult) session.getAttribute(SESSION_RESULT_KEY);
        ExportedFile file = exportService.exportAcceptanceCriteria(
                cached, new ResultFilter(epic, storyId, keyword), ExportFormat.fromString(format));
        return download(file);
    }

    private ResponseEntity<byte[]> download(ExportedFile file) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(file.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.parseMediaType(file.mediaType()))
                .body(file.content());
    }

    /**
     * Exposes the result, the filtered tables and the drop-down options to the view.
     */
    private void populateResult(Model model,
                                StoryExtractionResult result,
                                ResultFilter storyFilter,
                                ResultFilter criteriaFilter) {
        model.addAttribute("result", result);
        model.addAttribute("storyFilter", storyFilter);
        model.addAttribute("criteriaFilter", criteriaFilter);
        if (result == null) {
            model.addAttribute("notice", null);
            model.addAttribute("stories", List.of());
            model.addAttribute("acceptanceCriteria", List.of());
            model.addAttribute("epicOptions", List.of());
            model.addAttribute("acEpicOptions", List.of());
            model.addAttribute("storyIdOptions", List.of());
            return;
        }
        model.addAttribute("notice", result.isEmpty() ? NO_DATA_NOTICE : null);
        model.addAttribute("stories", filterService.filterStories(result.stories(), storyFilter));
        model.addAttribute("acceptanceCriteria",
                filterService.filterAcceptanceCriteria(result.acceptanceCriteria(), criteriaFilter));
        model.addAttribute("epicOptions", filterService.epicOptions(result.stories()));
        model.addAttribute("acEpicOptions", filterService.criteriaEpicOptions(result.acceptanceCriteria()));
        model.addAttribute("storyIdOptions",
                filterService.storyIdOptions(result.acceptanceCriteria(), criteriaFilter.epic()));
    }
}
