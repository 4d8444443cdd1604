package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.ParkingSlot.SlotStatus;

import java.time.LocalDateTime;

public record ParkingSlotResponse(
        Long id,
        String slotNumber,
        String size,
        String vehicleType,
        SlotStatus status,
        String location,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ParkingSlotResponse from(ParkingSlot slot) {
        return new ParkingSlotResponse(
                slot.getId(),
                slot.getSlotNumber(),
                slot.getSize(),
                slot.getVehicleType(),
                slot.getStatus(),
                slot.getLocation(),
                slot.getCreatedAt(),
                slot.getUpdatedAt()
        );
    }
}
