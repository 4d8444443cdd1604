package com.openparking.parking.domain.model;

/**
 * Closed set of account roles. Authorization points switch over every value.
 */
public enum Role {
    USER,
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }
}
