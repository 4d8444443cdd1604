package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.User;

public record AuthResponse(
        Long id,
        String name,
        String email,
        Role role,
        String token
) {
    public static AuthResponse from(User user, String token) {
        return new AuthResponse(user.getId(), user.getName(), user.getEmail(), user.getRole(), token);
    }
}
