package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.ParkingSlot.SlotStatus;

/**
 * Partial slot update; null or blank fields are left unchanged.
 */
public record UpdateParkingSlotRequest(
        String slotNumber,
        String size,
        String vehicleType,
        String location,
        SlotStatus status
) {
}
