package com.openparking.parking.api.dto;

import jakarta.validation.constraints.NotNull;

public record CreateSlotRequestRequest(
        @NotNull(message = "Vehicle ID is required")
        Long vehicleId
) {
}
