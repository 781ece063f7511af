package com.example.storyextractor.application.service;

import com.example.storyextractor.application.extraction.DocumentBlockWalker;
import com.example.storyextractor.domain.exception.DocumentFileRequiredException;
import com.example.storyextractor.domain.exception.DocumentNotFoundException;
import com.example.storyextractor.domain.exception.DocumentPathRequiredException;
import com.example.storyextractor.domain.exception.UnsupportedDocumentFormatException;
import com.example.storyextractor.domain.model.DocumentBlock;
import com.example.storyextractor.domain.model.RequirementsTables;
import com.example.storyextractor.domain.model.StoryExtractionResult;
import com.example.storyextractor.infrastructure.docx.PoiDocxBlockReader;
import com.example.storyextractor.infrastructure.exception.DocumentProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that orchestrates story extraction from Word documents.
 * It validates inputs, delegates POI interactions to the infrastructure reader, and hands the ordered blocks
 * to the {@link DocumentBlockWalker}.
 */
@Service
public class StoryExtractionService {

    private static final Logger log = LoggerFactory.getLogger(StoryExtractionService.class);
    private static final String DOCX_CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    private final PoiDocxBlockReader blockReader;
    private final DocumentBlockWalker blockWalker;

    /**
     * @param blockReader infrastructure reader that turns .docx bytes into blocks
     * @param blockWalker extraction core
     */
    public StoryExtractionService(PoiDocxBlockReader blockReader, DocumentBlockWalker blockWalker) {
        this.blockReader = blockReader;
        this.blockWalker = blockWalker;
    }

    /**
     * Extracts stories and acceptance criteria from an uploaded document.
     *
     * @param file uploaded .docx file
     * @return extraction result, possibly with empty tables
     * @throws DocumentFileRequiredException      when the file is null or empty
     * @throws UnsupportedDocumentFormatException when the MIME type/name does not look like a .docx
     * @throws DocumentProcessingException        when the bytes cannot be read
     */
    public StoryExtractionResult extract(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        if (!looksLikeDocx(file)) {
            throw new UnsupportedDocumentFormatException(file.getOriginalFilename());
        }
        String fileName = resolveFileName(file);
        try {
            return extractInternal(file.getBytes(), fileName);
        } catch (IOException e) {
            log.warn("Failed to read uploaded document {}", fileName, e);
            throw new DocumentProcessingException("Unable to process the uploaded document.", e);
        }
    }

    /**
     * Reads a document from the filesystem and extracts stories and acceptance criteria.
     *
     * @param docxPath path pointing to a .docx file on disk
     * @return extraction result, possibly with empty tables
     * @throws DocumentPathRequiredException when {@code docxPath} is null
     * @throws DocumentNotFoundException     when the path does not exist
     * @throws DocumentProcessingException   when the file cannot be read
     */
    public StoryExtractionResult extract(Path docxPath) {
        if (docxPath == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.exists(docxPath)) {
            throw new DocumentNotFoundException(docxPath.toAbsolutePath().toString());
        }
        try {
            byte[] bytes = Files.readAllBytes(docxPath);
            String fileName = docxPath.getFileName() != null ? docxPath.getFileName().toString() : "document.docx";
            return extractInternal(bytes, fileName);
        } catch (IOException e) {
            log.warn("Failed to read document {}", docxPath, e);
            throw new DocumentProcessingException("Unable to process the document at " + docxPath, e);
        }
    }

    private StoryExtractionResult extractInternal(byte[] bytes, String fileName) {
        List<DocumentBlock> blocks = blockReader.readBlocks(bytes);
        RequirementsTables tables = blockWalker.walk(blocks);
        log.info("Extracted {} stories and {} acceptance criteria from {} ({} blocks, module {})",
                tables.stories().size(), tables.acceptanceCriteria().size(), fileName, blocks.size(), tables.module());
        return StoryExtractionResult.of(fileName, tables);
    }

    private boolean looksLikeDocx(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase(DOCX_CONTENT_TYPE)) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".docx");
    }

    /**
     * @param file uploaded file
     * @return original filename or a default placeholder
     */
    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.docx";
        }
        return fileName;
    }
}
