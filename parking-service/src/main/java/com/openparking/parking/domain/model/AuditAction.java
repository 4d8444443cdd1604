package com.openparking.parking.domain.model;

/**
 * Action names written to the action log.
 */
public enum AuditAction {
    USER_REGISTERED,
    USER_LOGIN_SUCCESS,
    USER_LOGIN_FAILED,
    USER_PROFILE_UPDATED,
    USER_DELETED_BY_ADMIN,

    VEHICLE_ADDED,
    VEHICLE_VIEWED,
    VEHICLE_UPDATED,
    VEHICLE_DELETED,

    SLOT_CREATED,
    SLOTS_BULK_CREATED,
    SLOT_VIEWED,
    SLOT_UPDATED,
    SLOT_DELETED,

    SLOT_REQUEST_CREATED,
    SLOT_REQUEST_VIEWED,
    SLOT_REQUEST_UPDATED_BY_USER,
    SLOT_REQUEST_CANCELLED_BY_USER,
    SLOT_REQUEST_APPROVED,
    SLOT_REQUEST_REJECTED
}
