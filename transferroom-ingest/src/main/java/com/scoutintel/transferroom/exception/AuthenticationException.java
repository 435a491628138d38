package com.scoutintel.transferroom.exception;

/**
 * Login rejected, or the login response carried no usable token. Fatal to the run.
 */
public class AuthenticationException extends IngestionException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
