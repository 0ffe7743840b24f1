package com.openguide.common.exception;

/**
 * A conditional write lost its race. The client must reload the resource
 * and decide again; replaying the same request is pointless.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message) {
        super(message, "CONFLICT");
    }
}
