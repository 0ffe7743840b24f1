package com.openguide.common.exception;

/**
 * Thrown when a remote collaborator (directory, payment gateway) cannot be reached
 * and the operation cannot proceed without it. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
