package com.openguide.common.exception;

/**
 * Malformed input rejected before any write is attempted.
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
