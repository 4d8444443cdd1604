package com.openparking.parking.domain.service;

import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.Vehicle;
import com.openparking.parking.domain.repository.ParkingSlotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Selects parking slots that can serve a vehicle.
 *
 * A slot is compatible when it is AVAILABLE, has exactly the vehicle's size and either the
 * vehicle's type or the wildcard type "any" (case-insensitive). The repository queries apply the
 * predicate in SQL and every returned row is re-checked with {@link ParkingSlot#accepts(Vehicle)}.
 * Read-only: claiming the chosen slot is the caller's job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotMatcher {

    private final ParkingSlotRepository slotRepository;

    /**
     * With a manual slot id, validates that single slot; otherwise returns the oldest compatible slot.
     */
    public Optional<ParkingSlot> findCompatible(Vehicle vehicle, Long manualSlotId) {
        if (manualSlotId != null) {
            Optional<ParkingSlot> slot = slotRepository.findAvailableByIdFor(
                    manualSlotId, vehicle.getSize(), vehicle.getVehicleType())
                    .filter(candidate -> candidate.accepts(vehicle));
            log.debug("Manual slot {} compatible with vehicle {}: {}", manualSlotId, vehicle.getId(), slot.isPresent());
            return slot;
        }
        return candidates(vehicle).stream().findFirst();
    }

    /**
     * Every compatible slot in selection order (creation time, then id).
     */
    public List<ParkingSlot> candidates(Vehicle vehicle) {
        List<ParkingSlot> slots = slotRepository.findAvailableFor(vehicle.getSize(), vehicle.getVehicleType())
                .stream()
                .filter(slot -> slot.accepts(vehicle))
                .toList();
        log.debug("Found {} compatible slot(s) for vehicle {} (size={}, type={})",
                slots.size(), vehicle.getId(), vehicle.getSize(), vehicle.getVehicleType());
        return slots;
    }
}
