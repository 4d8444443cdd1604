package com.openparking.common.exception;

import lombok.Getter;

/**
 * Base class for domain errors surfaced to API callers.
 * Subclasses pick the error code; {@link GlobalExceptionHandler} picks the HTTP status.
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
