package com.example.storyextractor.domain.exception;

/**
 * Raised when the client runs an upload flow without providing a Word document.
 */
public class DocumentFileRequiredException extends DomainException {

    public DocumentFileRequiredException() {
        super("Please choose a Word document to upload.");
    }
}
