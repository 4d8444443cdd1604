package com.openparking.parking.exception;

import com.openparking.common.exception.BusinessException;

/**
 * Approval found no AVAILABLE slot matching the vehicle's size and type,
 * or the manually chosen slot does not match.
 */
public class NoCompatibleSlotException extends BusinessException {

    public NoCompatibleSlotException(String message) {
        super(message, "NO_COMPATIBLE_SLOT");
    }
}
