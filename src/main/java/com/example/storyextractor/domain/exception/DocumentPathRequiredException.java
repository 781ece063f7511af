package com.example.storyextractor.domain.exception;

/**
 * Raised when a caller attempts to extract stories from a null {@link java.nio.file.Path}.
 */
public class DocumentPathRequiredException extends DomainException {

    public DocumentPathRequiredException() {
        super("Document path is required.");
    }
}
