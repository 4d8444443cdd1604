package com.openparking.common.exception;

/**
 * The caller is authenticated but neither owns the resource nor holds the role that would allow the action.
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }
}
