package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.model.Vehicle;

import java.time.LocalDateTime;

/**
 * A slot request together with its vehicle, requester and bound slot.
 * Any of the three may be null: the slot is only bound once approved, and a vehicle
 * deleted after its request was resolved leaves the request in place.
 */
public record SlotRequestDetailResponse(
        Long id,
        RequestStatus requestStatus,
        String assignedSlotNumber,
        LocalDateTime approvedAt,
        String rejectionReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        VehicleResponse vehicle,
        UserSummary user,
        ParkingSlotResponse slot
) {
    public static SlotRequestDetailResponse from(SlotRequest request, Vehicle vehicle, User user, ParkingSlot slot) {
        return new SlotRequestDetailResponse(
                request.getId(),
                request.getRequestStatus(),
                request.getAssignedSlotNumber(),
                request.getApprovedAt(),
                request.getRejectionReason(),
                request.getCreatedAt(),
                request.getUpdatedAt(),
                vehicle == null ? null : VehicleResponse.from(vehicle),
                user == null ? null : UserSummary.from(user),
                slot == null ? null : ParkingSlotResponse.from(slot)
        );
    }
}
