package com.subscription.domain.exception;

/**
 * Permanent rejection of an inbound event: it can never be processed, however often it is retried.
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
