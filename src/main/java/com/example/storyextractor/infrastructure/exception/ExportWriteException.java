package com.example.storyextractor.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when an export file cannot be written.
 */
public class ExportWriteException extends InfrastructureException {
	/**
	 * @param message description of the export that failed
	 * @param cause   low-level IO or Apache POI exception
	 */
    public ExportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
