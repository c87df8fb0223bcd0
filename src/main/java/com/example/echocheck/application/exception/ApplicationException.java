package com.example.echocheck.application.exception;

/**
 * Root of the use-case failures around classification: a caller that is not authenticated,
 * or a classifier that could not produce a prediction.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * Creates a new application-layer exception with the provided message.
	 *
	 * @param message message returned in the error payload
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * Creates a new application-layer exception that wraps an underlying cause.
	 *
	 * @param message message returned in the error payload
	 * @param cause   adapter failure behind the use-case failure
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
