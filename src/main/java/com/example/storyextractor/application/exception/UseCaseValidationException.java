package com.example.storyextractor.application.exception;

/**
 * Signals validation issues detected while running an application layer use case.
 * Controllers may translate this exception into HTTP 400/422 responses depending on context.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
