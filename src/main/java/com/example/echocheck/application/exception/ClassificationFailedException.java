package com.example.echocheck.application.exception;

/**
 * Raised when the stance classifier could not produce a prediction for otherwise valid text.
 */
public class ClassificationFailedException extends ApplicationException {

	/**
	 * @param cause failure reported by the classifier adapter
	 */
    public ClassificationFailedException(Throwable cause) {
        super("Classification failed: " + cause.getMessage(), cause);
    }
}
