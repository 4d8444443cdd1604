package com.openparking.parking.security;

import com.openparking.parking.domain.model.Role;

/**
 * Principal placed in the security context by {@link AuthTokenFilter}.
 */
public record AuthenticatedUser(Long id, String email, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
