package com.subscription.domain.exception;

/**
 * The identity service answered with an error or a response this service cannot use.
 */
public class IdentityServiceException extends RuntimeException {

    public IdentityServiceException(String message) {
        super(message);
    }

    public IdentityServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
