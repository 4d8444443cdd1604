package com.openparking.parking.api.dto;

import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;

import java.time.LocalDateTime;

public record SlotRequestResponse(
        Long id,
        Long userId,
        Long vehicleId,
        Long slotId,
        String assignedSlotNumber,
        RequestStatus requestStatus,
        LocalDateTime approvedAt,
        String rejectionReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static SlotRequestResponse from(SlotRequest request) {
        return new SlotRequestResponse(
                request.getId(),
                request.getUserId(),
                request.getVehicleId(),
                request.getSlotId(),
                request.getAssignedSlotNumber(),
                request.getRequestStatus(),
                request.getApprovedAt(),
                request.getRejectionReason(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
