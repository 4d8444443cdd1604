package com.openparking.parking.exception;

import com.openparking.common.exception.BusinessException;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import lombok.Getter;

/**
 * A lifecycle operation was attempted on a slot request that is not PENDING.
 * The message always names the request's current status.
 */
@Getter
public class InvalidStateException extends BusinessException {

    private final RequestStatus currentStatus;

    public InvalidStateException(String message, RequestStatus currentStatus) {
        super(message, "INVALID_STATE");
        this.currentStatus = currentStatus;
    }
}
