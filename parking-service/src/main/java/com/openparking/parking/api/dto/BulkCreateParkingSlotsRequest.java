package com.openparking.parking.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Items are validated one by one so that a bad item does not fail the whole batch.
 */
public record BulkCreateParkingSlotsRequest(
        @NotEmpty(message = "Slots array is required and cannot be empty")
        List<CreateParkingSlotRequest> slots
) {
}
