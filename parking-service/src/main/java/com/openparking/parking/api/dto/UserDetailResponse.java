package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.model.Vehicle;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A user with short summaries of their vehicles and slot requests (admin view).
 */
public record UserDetailResponse(
        Long id,
        String name,
        String email,
        Role role,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<VehicleSummary> vehicles,
        List<RequestSummary> slotRequests
) {
    public record VehicleSummary(Long id, String plateNumber, String vehicleType) {
    }

    public record RequestSummary(Long id, SlotRequest.RequestStatus requestStatus, LocalDateTime createdAt) {
    }

    public static UserDetailResponse from(User user, List<Vehicle> vehicles, List<SlotRequest> requests) {
        return new UserDetailResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getRole(),
                user.getCreatedAt(),
                user.getUpdatedAt(),
                vehicles.stream()
                        .map(v -> new VehicleSummary(v.getId(), v.getPlateNumber(), v.getVehicleType()))
                        .toList(),
                requests.stream()
                        .map(r -> new RequestSummary(r.getId(), r.getRequestStatus(), r.getCreatedAt()))
                        .toList()
        );
    }
}
