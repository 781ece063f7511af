package com.example.storyextractor.domain.exception;

/**
 * Raised when the uploaded file does not look like a .docx document.
 * Legacy binary .doc files are rejected here as well.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Only .docx uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
