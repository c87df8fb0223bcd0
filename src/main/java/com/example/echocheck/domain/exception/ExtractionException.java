package com.example.echocheck.domain.exception;

/**
 * Raised when the ingestion pipeline rejects its input.
 * Carries the {@link ExtractionFailure} tag so the API layer can pick the status code and error code
 * without inspecting messages.
 */
public class ExtractionException extends DomainException {

    private final ExtractionFailure failure;

	/**
	 * Creates the exception with the failure's default message.
	 *
	 * @param failure rejection reason
	 */
    public ExtractionException(ExtractionFailure failure) {
        this(failure, failure.defaultMessage());
    }

	/**
	 * Creates the exception with a message tailored to the rejected input.
	 *
	 * @param failure rejection reason
	 * @param message human readable explanation shown to the caller
	 */
    public ExtractionException(ExtractionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

	/**
	 * Creates the exception and keeps the library failure that revealed the problem.
	 *
	 * @param failure rejection reason
	 * @param message human readable explanation shown to the caller
	 * @param cause   parser exception
	 */
    public ExtractionException(ExtractionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ExtractionFailure getFailure() {
        return failure;
    }
}
