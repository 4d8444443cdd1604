package com.openparking.parking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A physical parking slot.
 * Only the allocation engine moves a slot to {@link SlotStatus#UNAVAILABLE}; it does so with a
 * guarded UPDATE (see {@code ParkingSlotRepository#claimIfAvailable}).
 */
@Entity
@Table(name = "parking_slots", indexes = {
        @Index(name = "idx_slots_match", columnList = "status,size"),
        @Index(name = "idx_slots_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParkingSlot {
    public static final String ANY_VEHICLE_TYPE = "any";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_number", nullable = false, unique = true)
    private String slotNumber;

    @Column(name = "size", nullable = false)
    private String size;

    @Column(name = "vehicle_type", nullable = false)
    private String vehicleType;

    /** Written on insert only; afterwards it changes through the guarded UPDATEs of the repository. */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20, updatable = false)
    private SlotStatus status;

    @Column(name = "location", nullable = false)
    private String location;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = SlotStatus.AVAILABLE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * In-memory form of the compatibility predicate used by the matcher queries.
     * Size must match exactly; type must match exactly unless the slot accepts "any" (case-insensitive).
     */
    public boolean accepts(Vehicle vehicle) {
        return status == SlotStatus.AVAILABLE
                && size.equals(vehicle.getSize())
                && (vehicleType.equals(vehicle.getVehicleType()) || ANY_VEHICLE_TYPE.equalsIgnoreCase(vehicleType));
    }

    public enum SlotStatus {
        AVAILABLE,
        UNAVAILABLE,
        MAINTENANCE
    }
}
