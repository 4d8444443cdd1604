package com.openparking.parking.api.dto;

import java.util.List;

public record BulkCreateParkingSlotsResponse(
        List<ParkingSlotResponse> createdSlots,
        List<ItemError> errors
) {
    public record ItemError(CreateParkingSlotRequest slotData, String error) {
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
