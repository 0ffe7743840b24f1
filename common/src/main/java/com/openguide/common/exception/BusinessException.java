package com.openguide.common.exception;

import lombok.Getter;

/**
 * Root of the domain error taxonomy. Every subtype maps to one HTTP status
 * in {@link GlobalExceptionHandler}; callers switch on {@link #getErrorCode()}.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
