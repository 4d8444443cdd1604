package com.openparking.parking.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record CreateVehicleRequest(
        @NotBlank(message = "Plate number is required")
        String plateNumber,

        @NotBlank(message = "Vehicle type is required")
        String vehicleType,

        @NotBlank(message = "Size is required")
        String size,

        Map<String, Object> otherAttributes
) {
}
