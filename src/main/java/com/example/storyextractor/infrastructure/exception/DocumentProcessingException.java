package com.example.storyextractor.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while reading a Word document.
 */
public class DocumentProcessingException extends InfrastructureException {
	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or Apache POI exception
	 */
    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
