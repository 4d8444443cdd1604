package com.openparking.parking.api.dto;

import jakarta.validation.constraints.Size;

public record RejectSlotRequestRequest(
        @Size(max = 1000, message = "Rejection reason must be at most 1000 characters")
        String rejectionReason
) {
}
