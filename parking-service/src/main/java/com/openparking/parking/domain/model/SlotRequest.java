package com.openparking.parking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * A user's request for a parking slot for one vehicle.
 *
 * slotId and assignedSlotNumber are set exactly when the request is APPROVED;
 * REJECTED and CANCELLED are terminal.
 */
@Entity
@Table(name = "slot_requests", indexes = {
        @Index(name = "idx_slot_requests_user_id", columnList = "user_id"),
        @Index(name = "idx_slot_requests_vehicle_id", columnList = "vehicle_id"),
        @Index(name = "idx_slot_requests_slot_id", columnList = "slot_id"),
        @Index(name = "idx_slot_requests_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "slot_id")
    private Long slotId;

    @Column(name = "assigned_slot_number")
    private String assignedSlotNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_status", nullable = false, length = 20)
    private RequestStatus requestStatus;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (requestStatus == null) {
            requestStatus = RequestStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public boolean isPending() {
        return requestStatus == RequestStatus.PENDING;
    }

    /**
     * Binds the slot and moves to APPROVED. The caller must already hold the slot
     * (it has been flipped to UNAVAILABLE in the same transaction).
     */
    public void approve(ParkingSlot slot, LocalDateTime at) {
        if (!isPending()) {
            throw new IllegalStateException("Only a pending request can be approved, was " + requestStatus);
        }
        this.requestStatus = RequestStatus.APPROVED;
        this.slotId = slot.getId();
        this.assignedSlotNumber = slot.getSlotNumber();
        this.approvedAt = at;
    }

    public void reject(String reason) {
        if (!isPending()) {
            throw new IllegalStateException("Only a pending request can be rejected, was " + requestStatus);
        }
        this.requestStatus = RequestStatus.REJECTED;
        this.rejectionReason = reason;
    }

    public void cancel() {
        if (!isPending()) {
            throw new IllegalStateException("Only a pending request can be cancelled, was " + requestStatus);
        }
        this.requestStatus = RequestStatus.CANCELLED;
    }

    public enum RequestStatus {
        PENDING,
        APPROVED,
        REJECTED,
        CANCELLED;

        /** Statuses that count toward the one-active-request-per-vehicle rule. */
        public static final Set<RequestStatus> ACTIVE = EnumSet.of(PENDING, APPROVED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }
    }
}
