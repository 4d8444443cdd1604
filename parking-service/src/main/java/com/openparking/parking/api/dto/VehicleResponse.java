package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.Vehicle;

import java.time.LocalDateTime;
import java.util.Map;

public record VehicleResponse(
        Long id,
        Long userId,
        String plateNumber,
        String vehicleType,
        String size,
        Map<String, Object> otherAttributes,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static VehicleResponse from(Vehicle vehicle) {
        return new VehicleResponse(
                vehicle.getId(),
                vehicle.getUserId(),
                vehicle.getPlateNumber(),
                vehicle.getVehicleType(),
                vehicle.getSize(),
                vehicle.getOtherAttributes() == null ? Map.of() : vehicle.getOtherAttributes(),
                vehicle.getCreatedAt(),
                vehicle.getUpdatedAt()
        );
    }
}
