package com.openparking.parking.domain.service;

import com.openparking.common.dto.PageResponse;
import com.openparking.common.exception.BusinessException;
import com.openparking.common.exception.ConflictException;
import com.openparking.common.exception.ResourceNotFoundException;
import com.openparking.common.util.Pagination;
import com.openparking.parking.api.dto.BulkCreateParkingSlotsResponse;
import com.openparking.parking.api.dto.BulkCreateParkingSlotsResponse.ItemError;
import com.openparking.parking.api.dto.CreateParkingSlotRequest;
import com.openparking.parking.api.dto.ParkingSlotResponse;
import com.openparking.parking.api.dto.UpdateParkingSlotRequest;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.ParkingSlot.SlotStatus;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.repository.ParkingSlotRepository;
import com.openparking.parking.domain.repository.SlotRequestRepository;
import com.openparking.parking.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Administration of parking slots.
 *
 * A slot's status is never written through the entity after insert. Administrative status
 * changes use the same guarded UPDATE as slot assignment, so an edit can never silently undo
 * a concurrent approval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParkingSlotService {

    private final ParkingSlotRepository slotRepository;
    private final SlotRequestRepository requestRepository;
    private final ActionLogService actionLogService;

    @Transactional
    public ParkingSlotResponse createSlot(CreateParkingSlotRequest request, AuthenticatedUser admin) {
        ParkingSlot slot = insert(request);
        log.info("Parking slot {} ({}) created by admin {}", slot.getId(), slot.getSlotNumber(), admin.id());
        actionLogService.record(AuditAction.SLOT_CREATED, admin.id(),
                Map.of("slotId", slot.getId(), "slotNumber", slot.getSlotNumber()));
        return ParkingSlotResponse.from(slot);
    }

    /**
     * Creates each item independently: an invalid or duplicate item is reported and skipped,
     * the others are still created.
     */
    public BulkCreateParkingSlotsResponse bulkCreateSlots(List<CreateParkingSlotRequest> items,
                                                          AuthenticatedUser admin) {
        List<ParkingSlotResponse> created = new ArrayList<>();
        List<ItemError> errors = new ArrayList<>();

        for (CreateParkingSlotRequest item : items) {
            if (item == null || !hasText(item.slotNumber()) || !hasText(item.size())
                    || !hasText(item.vehicleType()) || !hasText(item.location())) {
                errors.add(new ItemError(item, "Missing required fields (slotNumber, size, vehicleType, location)"));
                continue;
            }
            try {
                created.add(ParkingSlotResponse.from(insert(item)));
            } catch (ConflictException e) {
                errors.add(new ItemError(item, e.getMessage()));
            } catch (DataIntegrityViolationException e) {
                log.warn("Bulk insert of slot {} failed: {}", item.slotNumber(), e.getMostSpecificCause().getMessage());
                errors.add(new ItemError(item, "Slot number " + item.slotNumber() + " already exists."));
            }
        }

        log.info("Bulk slot creation by admin {}: {} created, {} failed", admin.id(), created.size(), errors.size());
        actionLogService.record(AuditAction.SLOTS_BULK_CREATED, admin.id(),
                Map.of("createdCount", created.size(), "errorCount", errors.size()));
        return new BulkCreateParkingSlotsResponse(created, errors);
    }

    /**
     * Users only ever see AVAILABLE slots; administrators may filter by any status.
     * Ordered by slot number.
     */
    @Transactional(readOnly = true)
    public PageResponse<ParkingSlotResponse> listSlots(AuthenticatedUser actor, String status, String search,
                                                       Integer page, Integer limit) {
        String term = Pagination.searchTerm(search);
        Pageable pageable = Pagination.of(page, limit, Sort.by("slotNumber"));
        SlotStatus filter = switch (actor.role()) {
            case USER -> SlotStatus.AVAILABLE;
            case ADMIN -> parseStatus(status);
        };

        Page<ParkingSlot> slots = filter == null
                ? slotRepository.search(term, pageable)
                : slotRepository.searchByStatus(filter, term, pageable);
        return PageResponse.from(slots, ParkingSlotResponse::from);
    }

    @Transactional(readOnly = true)
    public ParkingSlotResponse getSlot(Long slotId, AuthenticatedUser actor) {
        ParkingSlot slot = findSlot(slotId);
        actionLogService.record(AuditAction.SLOT_VIEWED, actor.id(), Map.of("slotId", slotId));
        return ParkingSlotResponse.from(slot);
    }

    /**
     * Partial update. The status may be set to AVAILABLE or MAINTENANCE, and only while no
     * approved request holds the slot; UNAVAILABLE is set by slot assignment alone.
     */
    @Transactional
    public ParkingSlotResponse updateSlot(Long slotId, UpdateParkingSlotRequest request, AuthenticatedUser admin) {
        ParkingSlot slot = findSlot(slotId);

        if (hasText(request.slotNumber()) && !request.slotNumber().trim().equals(slot.getSlotNumber())
                && slotRepository.existsBySlotNumber(request.slotNumber().trim())) {
            throw new ConflictException("Slot number " + request.slotNumber().trim() + " already taken.");
        }

        SlotStatus target = request.status();
        if (target != null && target != slot.getStatus()) {
            if (target == SlotStatus.UNAVAILABLE) {
                throw new BusinessException("Status UNAVAILABLE is set by slot assignment only. "
                        + "Use AVAILABLE or MAINTENANCE.", "VALIDATION_ERROR");
            }
            if (requestRepository.existsBySlotIdAndRequestStatus(slotId, RequestStatus.APPROVED)) {
                throw new ConflictException("Cannot change the status of a slot assigned to an approved request.");
            }
            if (slotRepository.compareAndSetStatus(slotId, slot.getStatus(), target, LocalDateTime.now()) != 1) {
                throw new ConflictException("Parking slot " + slot.getSlotNumber() + " was modified concurrently. Retry.");
            }
            slot.setStatus(target);
        }

        if (hasText(request.slotNumber())) {
            slot.setSlotNumber(request.slotNumber().trim());
        }
        if (hasText(request.size())) {
            slot.setSize(request.size().trim());
        }
        if (hasText(request.vehicleType())) {
            slot.setVehicleType(request.vehicleType().trim());
        }
        if (hasText(request.location())) {
            slot.setLocation(request.location().trim());
        }
        slot = slotRepository.save(slot);
        log.info("Parking slot {} updated by admin {}", slotId, admin.id());

        actionLogService.record(AuditAction.SLOT_UPDATED, admin.id(), Map.of("slotId", slotId));
        return ParkingSlotResponse.from(slot);
    }

    /**
     * Refused while an approved request holds the slot. An AVAILABLE slot is first taken out
     * of service so that no approval can claim it while it is being deleted.
     */
    @Transactional
    public void deleteSlot(Long slotId, AuthenticatedUser admin) {
        ParkingSlot slot = findSlot(slotId);
        if (requestRepository.existsBySlotIdAndRequestStatus(slotId, RequestStatus.APPROVED)) {
            throw new ConflictException("Cannot delete slot. It is currently assigned to an approved request. "
                    + "Resolve the request first.");
        }
        if (slot.getStatus() == SlotStatus.AVAILABLE && !slotRepository.takeOutOfService(slotId)) {
            throw new ConflictException("Cannot delete slot. It was just assigned to a request.");
        }

        slotRepository.deleteById(slotId);
        log.info("Parking slot {} ({}) deleted by admin {}", slotId, slot.getSlotNumber(), admin.id());
        actionLogService.record(AuditAction.SLOT_DELETED, admin.id(),
                Map.of("slotId", slotId, "slotNumber", slot.getSlotNumber()));
    }

    private ParkingSlot insert(CreateParkingSlotRequest request) {
        String slotNumber = request.slotNumber().trim();
        if (slotRepository.existsBySlotNumber(slotNumber)) {
            throw new ConflictException("Slot number " + slotNumber + " already exists.");
        }
        return slotRepository.save(ParkingSlot.builder()
                .slotNumber(slotNumber)
                .size(request.size().trim())
                .vehicleType(request.vehicleType().trim())
                .location(request.location().trim())
                .status(SlotStatus.AVAILABLE)
                .build());
    }

    private ParkingSlot findSlot(Long slotId) {
        return slotRepository.findById(slotId)
                .orElseThrow(() -> new ResourceNotFoundException("Parking slot", slotId));
    }

    static SlotStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return SlotStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown slot status filter '{}'", status);
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
