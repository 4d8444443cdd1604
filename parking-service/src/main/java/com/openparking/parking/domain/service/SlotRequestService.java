package com.openparking.parking.domain.service;

import com.openparking.common.dto.PageResponse;
import com.openparking.common.exception.ConflictException;
import com.openparking.common.exception.ForbiddenException;
import com.openparking.common.exception.ResourceNotFoundException;
import com.openparking.common.util.Pagination;
import com.openparking.parking.api.dto.SlotRequestDetailResponse;
import com.openparking.parking.api.dto.SlotRequestResponse;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.model.Vehicle;
import com.openparking.parking.domain.repository.ParkingSlotRepository;
import com.openparking.parking.domain.repository.SlotRequestRepository;
import com.openparking.parking.domain.repository.UserRepository;
import com.openparking.parking.domain.repository.VehicleRepository;
import com.openparking.parking.events.SlotRequestEvent;
import com.openparking.parking.events.SlotRequestEventPublisher;
import com.openparking.parking.exception.InvalidStateException;
import com.openparking.parking.exception.NoCompatibleSlotException;
import com.openparking.parking.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.openparking.parking.domain.repository.SlotRequestSpecifications.hasStatus;
import static com.openparking.parking.domain.repository.SlotRequestSpecifications.ownedBy;
import static com.openparking.parking.domain.repository.SlotRequestSpecifications.plateContains;
import static com.openparking.parking.domain.repository.SlotRequestSpecifications.plateOrRequesterContains;

/**
 * Lifecycle of slot requests: PENDING, then APPROVED, REJECTED or CANCELLED.
 *
 * Every transition reads the request row with a pessimistic write lock, so concurrent
 * transitions of the same request serialize and the second one sees the first one's result.
 * Audit records and requester emails are emitted through {@link SlotRequestEventPublisher}
 * and only happen once the transition has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotRequestService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final SlotRequestRepository requestRepository;
    private final VehicleRepository vehicleRepository;
    private final UserRepository userRepository;
    private final ParkingSlotRepository slotRepository;
    private final SlotMatcher slotMatcher;
    private final SlotRequestEventPublisher eventPublisher;
    private final ActionLogService actionLogService;

    /**
     * Opens a PENDING request for one of the caller's vehicles.
     * The vehicle row stays locked until commit, so two concurrent creates for the same
     * vehicle cannot both pass the active-request check.
     */
    @Transactional
    public SlotRequestResponse create(Long vehicleId, AuthenticatedUser user) {
        Vehicle vehicle = vehicleRepository.findByIdWithLock(vehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", vehicleId));
        if (!vehicle.isOwnedBy(user.id())) {
            throw new ForbiddenException("You can only request slots for your own vehicles.");
        }

        Optional<SlotRequest> active = requestRepository.findFirstByVehicleIdAndRequestStatusIn(
                vehicleId, RequestStatus.ACTIVE);
        if (active.isPresent()) {
            throw new ConflictException("An active slot request (Status: " + active.get().getRequestStatus()
                    + ") already exists for this vehicle.");
        }

        SlotRequest request = requestRepository.save(SlotRequest.builder()
                .userId(user.id())
                .vehicleId(vehicleId)
                .requestStatus(RequestStatus.PENDING)
                .build());
        log.info("Slot request {} created by user {} for vehicle {}", request.getId(), user.id(), vehicleId);

        eventPublisher.publish(SlotRequestEvent.Type.CREATED, request, user.id());
        return SlotRequestResponse.from(request);
    }

    /**
     * Points a PENDING request at another of the caller's vehicles.
     */
    @Transactional
    public SlotRequestResponse update(Long requestId, Long newVehicleId, AuthenticatedUser user) {
        SlotRequest request = lockRequest(requestId);
        if (!request.isOwnedBy(user.id())) {
            throw new ForbiddenException("Not authorized to update this slot request.");
        }
        if (!request.isPending()) {
            throw new InvalidStateException("Cannot update request. Status is already "
                    + request.getRequestStatus() + ".", request.getRequestStatus());
        }

        Vehicle newVehicle = vehicleRepository.findByIdWithLock(newVehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", newVehicleId));
        if (!newVehicle.isOwnedBy(user.id())) {
            throw new ForbiddenException("Invalid or unauthorized vehicle ID provided for update.");
        }

        if (!newVehicle.getId().equals(request.getVehicleId())) {
            requestRepository.findFirstByVehicleIdAndRequestStatusInAndIdNot(
                            newVehicle.getId(), RequestStatus.ACTIVE, request.getId())
                    .ifPresent(existing -> {
                        throw new ConflictException("An active slot request (Status: " + existing.getRequestStatus()
                                + ") already exists for the new vehicle (Plate: " + newVehicle.getPlateNumber() + ").");
                    });
        }

        request.setVehicleId(newVehicle.getId());
        request = requestRepository.save(request);
        log.info("Slot request {} moved to vehicle {} by user {}", requestId, newVehicleId, user.id());

        eventPublisher.publish(SlotRequestEvent.Type.UPDATED, request, user.id());
        return SlotRequestResponse.from(request);
    }

    @Transactional
    public SlotRequestResponse cancel(Long requestId, AuthenticatedUser user) {
        SlotRequest request = lockRequest(requestId);
        if (!request.isOwnedBy(user.id())) {
            throw new ForbiddenException("Not authorized to cancel this slot request.");
        }
        if (!request.isPending()) {
            throw new InvalidStateException("Cannot cancel request. Status is already "
                    + request.getRequestStatus() + ".", request.getRequestStatus());
        }

        request.cancel();
        request = requestRepository.save(request);
        log.info("Slot request {} cancelled by user {}", requestId, user.id());

        eventPublisher.publish(SlotRequestEvent.Type.CANCELLED, request, user.id());
        return SlotRequestResponse.from(request);
    }

    /**
     * Approves a PENDING request and binds a slot to it.
     *
     * The slot is claimed with a guarded UPDATE (AVAILABLE to UNAVAILABLE) before the request is
     * modified. If no slot can be claimed the transaction rolls back and the request stays PENDING.
     *
     * @param manualSlotId slot chosen by the administrator, or null for automatic selection
     */
    @Transactional
    public SlotRequestResponse approve(Long requestId, Long manualSlotId, AuthenticatedUser admin) {
        SlotRequest request = lockRequest(requestId);
        if (!request.isPending()) {
            throw new InvalidStateException("Request already "
                    + lowerCase(request.getRequestStatus()), request.getRequestStatus());
        }

        Vehicle vehicle = vehicleRepository.findById(request.getVehicleId())
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", request.getVehicleId()));
        ParkingSlot slot = claimSlot(vehicle, manualSlotId);

        request.approve(slot, LocalDateTime.now());
        SlotRequest approved = requestRepository.save(request);
        log.info("Slot request {} approved by admin {}: slot {} ({}) assigned to vehicle {}",
                requestId, admin.id(), slot.getId(), slot.getSlotNumber(), vehicle.getId());

        eventPublisher.publish(SlotRequestEvent.Type.APPROVED, approved, admin.id());
        return SlotRequestResponse.from(approved);
    }

    @Transactional
    public SlotRequestResponse reject(Long requestId, String reason, AuthenticatedUser admin) {
        SlotRequest request = lockRequest(requestId);
        if (!request.isPending()) {
            throw new InvalidStateException("Request is already "
                    + lowerCase(request.getRequestStatus()) + ". Cannot reject.", request.getRequestStatus());
        }

        String normalizedReason = reason == null || reason.isBlank() ? null : reason.trim();
        request.reject(normalizedReason);
        request = requestRepository.save(request);
        log.info("Slot request {} rejected by admin {}", requestId, admin.id());

        eventPublisher.publish(SlotRequestEvent.Type.REJECTED, request, admin.id(), normalizedReason);
        return SlotRequestResponse.from(request);
    }

    /**
     * Newest requests first. Users only see their own requests and search by plate;
     * administrators see all and may also search by requester name or email.
     * An unrecognized status filter is ignored.
     */
    @Transactional(readOnly = true)
    public PageResponse<SlotRequestDetailResponse> list(AuthenticatedUser actor, String status, String search,
                                                        Integer page, Integer limit) {
        String term = Pagination.searchTerm(search);
        Specification<SlotRequest> spec = switch (actor.role()) {
            case ADMIN -> Specification.where(plateOrRequesterContains(term));
            case USER -> Specification.where(ownedBy(actor.id())).and(plateContains(term));
        };
        spec = spec.and(hasStatus(parseStatus(status)));

        Page<SlotRequest> requests = requestRepository.findAll(spec, Pagination.of(page, limit, NEWEST_FIRST));

        Map<Long, Vehicle> vehicles = byId(vehicleRepository.findAllById(
                idsOf(requests, SlotRequest::getVehicleId)), Vehicle::getId);
        Map<Long, User> users = byId(userRepository.findAllById(
                idsOf(requests, SlotRequest::getUserId)), User::getId);
        Map<Long, ParkingSlot> slots = byId(slotRepository.findAllById(
                idsOf(requests, SlotRequest::getSlotId)), ParkingSlot::getId);

        return PageResponse.from(requests, r -> SlotRequestDetailResponse.from(r,
                vehicles.get(r.getVehicleId()), users.get(r.getUserId()),
                r.getSlotId() == null ? null : slots.get(r.getSlotId())));
    }

    @Transactional(readOnly = true)
    public SlotRequestDetailResponse get(Long requestId, AuthenticatedUser actor) {
        SlotRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot request", requestId));
        boolean allowed = switch (actor.role()) {
            case ADMIN -> true;
            case USER -> request.isOwnedBy(actor.id());
        };
        if (!allowed) {
            throw new ForbiddenException("Not authorized to view this slot request");
        }

        Vehicle vehicle = vehicleRepository.findById(request.getVehicleId()).orElse(null);
        User user = userRepository.findById(request.getUserId()).orElse(null);
        ParkingSlot slot = request.getSlotId() == null ? null
                : slotRepository.findById(request.getSlotId()).orElse(null);

        actionLogService.record(AuditAction.SLOT_REQUEST_VIEWED, actor.id(), Map.of("requestId", requestId));
        return SlotRequestDetailResponse.from(request, vehicle, user, slot);
    }

    private SlotRequest lockRequest(Long requestId) {
        return requestRepository.findByIdWithLock(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot request", requestId));
    }

    /**
     * Picks a compatible slot and flips it to UNAVAILABLE. A manually chosen slot gets a single
     * attempt; in automatic mode a candidate taken by a concurrent approval is skipped in favour
     * of the next one in selection order.
     */
    private ParkingSlot claimSlot(Vehicle vehicle, Long manualSlotId) {
        if (manualSlotId != null) {
            ParkingSlot slot = slotMatcher.findCompatible(vehicle, manualSlotId)
                    .filter(s -> slotRepository.claimIfAvailable(s.getId()))
                    .orElseThrow(() -> new NoCompatibleSlotException(
                            "Manually assigned slot is not available or not compatible."));
            slot.setStatus(ParkingSlot.SlotStatus.UNAVAILABLE);
            return slot;
        }

        for (ParkingSlot candidate : slotMatcher.candidates(vehicle)) {
            if (slotRepository.claimIfAvailable(candidate.getId())) {
                candidate.setStatus(ParkingSlot.SlotStatus.UNAVAILABLE);
                return candidate;
            }
            log.info("Slot {} was claimed concurrently, trying next candidate", candidate.getId());
        }
        throw new NoCompatibleSlotException("No compatible parking slot available for this vehicle.");
    }

    static RequestStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        String normalized = status.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(RequestStatus.values())
                .filter(s -> s.name().equals(normalized))
                .findFirst()
                .orElse(null);
    }

    private static String lowerCase(RequestStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static Collection<Long> idsOf(Page<SlotRequest> page, Function<SlotRequest, Long> id) {
        return page.getContent().stream()
                .map(id)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static <T> Map<Long, T> byId(Collection<T> entities, Function<T, Long> id) {
        return entities.stream().collect(Collectors.toMap(id, Function.identity()));
    }
}
