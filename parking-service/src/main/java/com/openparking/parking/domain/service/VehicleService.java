package com.openparking.parking.domain.service;

import com.openparking.common.dto.PageResponse;
import com.openparking.common.exception.ConflictException;
import com.openparking.common.exception.ForbiddenException;
import com.openparking.common.exception.ResourceNotFoundException;
import com.openparking.common.util.Pagination;
import com.openparking.parking.api.dto.CreateVehicleRequest;
import com.openparking.parking.api.dto.UpdateVehicleRequest;
import com.openparking.parking.api.dto.VehicleResponse;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.model.Vehicle;
import com.openparking.parking.domain.repository.SlotRequestRepository;
import com.openparking.parking.domain.repository.VehicleRepository;
import com.openparking.parking.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vehicles registered by users. Size and type feed the slot matcher.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VehicleService {

    private final VehicleRepository vehicleRepository;
    private final SlotRequestRepository requestRepository;
    private final ActionLogService actionLogService;

    @Transactional
    public VehicleResponse addVehicle(CreateVehicleRequest request, AuthenticatedUser owner) {
        String plate = request.plateNumber().trim();
        if (vehicleRepository.existsByPlateNumber(plate)) {
            throw new ConflictException("Vehicle with this plate number already exists.");
        }

        Vehicle vehicle = vehicleRepository.save(Vehicle.builder()
                .userId(owner.id())
                .plateNumber(plate)
                .vehicleType(request.vehicleType().trim())
                .size(request.size().trim())
                .otherAttributes(copyOf(request.otherAttributes()))
                .build());
        log.info("Vehicle {} ({}) added by user {}", vehicle.getId(), plate, owner.id());

        actionLogService.record(AuditAction.VEHICLE_ADDED, owner.id(),
                Map.of("vehicleId", vehicle.getId(), "plateNumber", plate));
        return VehicleResponse.from(vehicle);
    }

    /**
     * The caller's own vehicles, newest first, filtered by plate or type.
     */
    @Transactional(readOnly = true)
    public PageResponse<VehicleResponse> listOwnVehicles(AuthenticatedUser owner, String search,
                                                         Integer page, Integer limit) {
        return PageResponse.from(
                vehicleRepository.searchOwned(owner.id(), Pagination.searchTerm(search),
                        Pagination.of(page, limit, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")))),
                VehicleResponse::from);
    }

    @Transactional(readOnly = true)
    public VehicleResponse getVehicle(Long vehicleId, AuthenticatedUser actor) {
        Vehicle vehicle = findVehicle(vehicleId);
        boolean allowed = switch (actor.role()) {
            case ADMIN -> true;
            case USER -> vehicle.isOwnedBy(actor.id());
        };
        if (!allowed) {
            throw new ForbiddenException("Not authorized to view this vehicle");
        }
        actionLogService.record(AuditAction.VEHICLE_VIEWED, actor.id(), Map.of("vehicleId", vehicleId));
        return VehicleResponse.from(vehicle);
    }

    /**
     * Updates type, size and attributes. The plate number cannot be changed.
     */
    @Transactional
    public VehicleResponse updateVehicle(Long vehicleId, UpdateVehicleRequest request, AuthenticatedUser owner) {
        Vehicle vehicle = findVehicle(vehicleId);
        if (!vehicle.isOwnedBy(owner.id())) {
            throw new ForbiddenException("Not authorized to update this vehicle");
        }

        if (hasText(request.vehicleType())) {
            vehicle.setVehicleType(request.vehicleType().trim());
        }
        if (hasText(request.size())) {
            vehicle.setSize(request.size().trim());
        }
        if (request.otherAttributes() != null) {
            vehicle.setOtherAttributes(copyOf(request.otherAttributes()));
        }
        vehicle = vehicleRepository.save(vehicle);
        log.info("Vehicle {} updated by user {}", vehicleId, owner.id());

        actionLogService.record(AuditAction.VEHICLE_UPDATED, owner.id(), Map.of("vehicleId", vehicleId));
        return VehicleResponse.from(vehicle);
    }

    /**
     * Refused while the vehicle has a PENDING or APPROVED request. Resolved requests keep
     * their vehicle reference after the vehicle is gone.
     */
    @Transactional
    public void deleteVehicle(Long vehicleId, AuthenticatedUser owner) {
        Vehicle vehicle = vehicleRepository.findByIdWithLock(vehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", vehicleId));
        if (!vehicle.isOwnedBy(owner.id())) {
            throw new ForbiddenException("Not authorized to delete this vehicle");
        }
        if (requestRepository.countByVehicleIdAndRequestStatusIn(vehicleId, RequestStatus.ACTIVE) > 0) {
            throw new ConflictException("Cannot delete vehicle with active or approved parking requests. "
                    + "Please cancel/resolve them first.");
        }

        vehicleRepository.delete(vehicle);
        log.info("Vehicle {} ({}) deleted by user {}", vehicleId, vehicle.getPlateNumber(), owner.id());
        actionLogService.record(AuditAction.VEHICLE_DELETED, owner.id(),
                Map.of("vehicleId", vehicleId, "plateNumber", vehicle.getPlateNumber()));
    }

    private Vehicle findVehicle(Long vehicleId) {
        return vehicleRepository.findById(vehicleId)
                .orElseThrow(() -> new ResourceNotFoundException("Vehicle", vehicleId));
    }

    private static Map<String, Object> copyOf(Map<String, Object> attributes) {
        return attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
