package com.example.storyextractor.application.exception;

/**
 * Thrown when a download is requested but there is no extraction result to export.
 */
public class ExportValidationException extends UseCaseValidationException {

    public ExportValidationException(String message) {
        super(message);
    }
}
