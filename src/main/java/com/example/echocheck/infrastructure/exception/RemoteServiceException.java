package com.example.echocheck.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when a remote collaborator (classifier, token service)
 * fails or answers with something we cannot interpret.
 */
public class RemoteServiceException extends InfrastructureException {

	/**
	 * @param message description of the failed call
	 * @param cause   client exception, or {@code null} when the payload itself was unusable
	 */
    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
