package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.User;

public record UserSummary(Long id, String name, String email) {
    public static UserSummary from(User user) {
        return new UserSummary(user.getId(), user.getName(), user.getEmail());
    }
}
