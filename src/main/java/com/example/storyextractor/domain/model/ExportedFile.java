package com.example.storyextractor.domain.model;

/**
 * Download payload produced by the export services.
 */
public record ExportedFile(String fileName, String mediaType, byte[] content) {
}
