package com.openparking.parking.api.exception;

import com.openparking.common.dto.BaseResponse;
import com.openparking.parking.exception.InvalidStateException;
import com.openparking.parking.exception.NoCompatibleSlotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Parking-specific error mapping. Runs before the shared {@code GlobalExceptionHandler},
 * whose {@code BusinessException} fallback would otherwise answer 400 for these types.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ParkingExceptionHandler {

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidState(InvalidStateException ex) {
        log.warn("Invalid state ({}): {}", ex.getCurrentStatus(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(NoCompatibleSlotException.class)
    public ResponseEntity<BaseResponse<?>> handleNoCompatibleSlot(NoCompatibleSlotException ex) {
        log.warn("No compatible slot: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BadCredentialsException.class)
    public ResponseEntity<BaseResponse<?>> handleBadCredentials(BadCredentialsException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(BaseResponse.error(ex.getMessage(), "UNAUTHORIZED"));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<BaseResponse<?>> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(BaseResponse.error("Access denied", "FORBIDDEN"));
    }

    /**
     * A unique constraint lost a race that the service-level existence check could not see.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<BaseResponse<?>> handleDataIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error("The resource conflicts with an existing one", "CONFLICT"));
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<BaseResponse<?>> handleLockFailure(PessimisticLockingFailureException ex) {
        log.warn("Lock acquisition failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error("The resource is being modified concurrently. Retry.", "CONFLICT"));
    }
}
