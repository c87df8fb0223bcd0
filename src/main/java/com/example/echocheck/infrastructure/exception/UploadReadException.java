package com.example.echocheck.infrastructure.exception;

/**
 * Infrastructure-layer exception signalling that the multipart body could not be read.
 */
public class UploadReadException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   IO failure raised by the servlet container
	 */
    public UploadReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
