package com.example.echocheck.application.exception;

/**
 * Signals that a protected use case was invoked without a valid access token.
 * Controllers translate this exception into an HTTP 401 response.
 */
public class UnauthorizedException extends ApplicationException {

	/**
	 * @param message reason the credentials were refused
	 */
    public UnauthorizedException(String message) {
        super(message);
    }
}
