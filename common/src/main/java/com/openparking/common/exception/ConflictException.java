package com.openparking.common.exception;

/**
 * The action would break a uniqueness rule, e.g. a second active request for one vehicle
 * or a duplicate plate number.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message) {
        super(message, "CONFLICT");
    }
}
