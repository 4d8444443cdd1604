package com.openparking.parking.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update; null or blank fields are left unchanged.
 */
public record UpdateProfileRequest(
        String name,

        @Email(message = "Email must be valid")
        String email,

        @Size(min = 6, message = "Password must be at least 6 characters")
        String password
) {
}
