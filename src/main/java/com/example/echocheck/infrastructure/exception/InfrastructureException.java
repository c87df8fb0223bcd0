package com.example.echocheck.infrastructure.exception;

/**
 * Root of the failures of the service's own plumbing: reading the upload body, or calling the
 * classifier and identity services. Reported as 500, never blamed on the uploaded content.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message which read or remote call failed
	 * @param cause   I/O or HTTP client exception
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
