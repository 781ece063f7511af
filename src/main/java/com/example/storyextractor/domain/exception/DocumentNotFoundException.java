package com.example.storyextractor.domain.exception;

/**
 * Raised when a referenced document path does not exist on disk.
 */
public class DocumentNotFoundException extends DomainException {

	/**
	 * @param path absolute or relative path that could not be resolved
	 */
    public DocumentNotFoundException(String path) {
        super("Document not found: " + path);
    }
}
