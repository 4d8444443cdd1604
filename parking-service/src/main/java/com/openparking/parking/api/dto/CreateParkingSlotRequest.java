package com.openparking.parking.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateParkingSlotRequest(
        @NotBlank(message = "Slot number is required")
        String slotNumber,

        @NotBlank(message = "Size is required")
        String size,

        @NotBlank(message = "Vehicle type is required")
        String vehicleType,

        @NotBlank(message = "Location is required")
        String location
) {
}
