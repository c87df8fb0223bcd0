package com.example.echocheck.domain.exception;

/**
 * Root of the failures raised when an upload or a piece of text is refused.
 * Mapped to 400 by the API layer unless a subclass carries a more specific status.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message reason the input was refused, safe to return to the client
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule rejected the input
	 * @param cause   parser or decoder failure that revealed the problem
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
