package com.openparking.parking.api.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateSlotRequestRequest(
        @NotNull(message = "New vehicle ID is required")
        Long vehicleId
) {
}
