package com.openparking.parking.api.dto;

import java.util.Map;

/**
 * The plate number is immutable. Null fields are left unchanged;
 * a non-null {@code otherAttributes} replaces the whole bag.
 */
public record UpdateVehicleRequest(
        String vehicleType,
        String size,
        Map<String, Object> otherAttributes
) {
}
