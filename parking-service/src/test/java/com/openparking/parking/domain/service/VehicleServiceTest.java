package com.openparking.parking.domain.service;

import com.openparking.common.exception.ConflictException;
import com.openparking.common.exception.ForbiddenException;
import com.openparking.parking.api.dto.CreateVehicleRequest;
import com.openparking.parking.api.dto.UpdateVehicleRequest;
import com.openparking.parking.api.dto.VehicleResponse;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import com.openparking.parking.domain.model.Vehicle;
import com.openparking.parking.domain.repository.SlotRequestRepository;
import com.openparking.parking.domain.repository.VehicleRepository;
import com.openparking.parking.security.AuthenticatedUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VehicleServiceTest {

    private static final AuthenticatedUser ALICE = new AuthenticatedUser(1L, "alice@example.com", Role.USER);
    private static final AuthenticatedUser BOB = new AuthenticatedUser(2L, "bob@example.com", Role.USER);
    private static final AuthenticatedUser ADMIN = new AuthenticatedUser(99L, "admin@example.com", Role.ADMIN);

    @Mock
    private VehicleRepository vehicleRepository;
    @Mock
    private SlotRequestRepository requestRepository;
    @Mock
    private ActionLogService actionLogService;

    @InjectMocks
    private VehicleService service;

    private static Vehicle alicesCar() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("color", "red");
        return Vehicle.builder()
                .id(10L).userId(1L).plateNumber("AB-123").vehicleType("car").size("medium")
                .otherAttributes(attributes)
                .build();
    }

    @Test
    @DisplayName("addVehicle stores the vehicle for its owner with its free-form attributes")
    void addVehicle_success() {
        when(vehicleRepository.existsByPlateNumber("AB-123")).thenReturn(false);
        when(vehicleRepository.save(any(Vehicle.class))).thenAnswer(inv -> {
            Vehicle v = inv.getArgument(0);
            v.setId(10L);
            return v;
        });

        VehicleResponse response = service.addVehicle(
                new CreateVehicleRequest(" AB-123 ", "car", "medium", Map.of("color", "red")), ALICE);

        assertThat(response.userId()).isEqualTo(1L);
        assertThat(response.plateNumber()).isEqualTo("AB-123");
        assertThat(response.otherAttributes()).containsEntry("color", "red");
        verify(actionLogService).record(eq(AuditAction.VEHICLE_ADDED), eq(1L), anyMap());
    }

    @Test
    @DisplayName("plate numbers are unique across all users")
    void addVehicle_duplicatePlate() {
        when(vehicleRepository.existsByPlateNumber("AB-123")).thenReturn(true);

        assertThatThrownBy(() -> service.addVehicle(
                new CreateVehicleRequest("AB-123", "car", "medium", null), BOB))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Vehicle with this plate number already exists.");
    }

    @Test
    @DisplayName("a user cannot view someone else's vehicle, an admin can")
    void getVehicle_ownership() {
        when(vehicleRepository.findById(10L)).thenReturn(Optional.of(alicesCar()));

        assertThatThrownBy(() -> service.getVehicle(10L, BOB)).isInstanceOf(ForbiddenException.class);
        assertThat(service.getVehicle(10L, ADMIN).plateNumber()).isEqualTo("AB-123");
        verify(actionLogService).record(eq(AuditAction.VEHICLE_VIEWED), eq(99L), anyMap());
    }

    @Test
    @DisplayName("updateVehicle changes only the given fields and replaces the attribute bag")
    void updateVehicle_partial() {
        when(vehicleRepository.findById(10L)).thenReturn(Optional.of(alicesCar()));
        when(vehicleRepository.save(any(Vehicle.class))).thenAnswer(inv -> inv.getArgument(0));

        VehicleResponse response = service.updateVehicle(10L,
                new UpdateVehicleRequest(null, "large", Map.of("ev", true)), ALICE);

        assertThat(response.vehicleType()).isEqualTo("car");
        assertThat(response.size()).isEqualTo("large");
        assertThat(response.otherAttributes()).containsOnlyKeys("ev");
    }

    @Test
    @DisplayName("only the owner may update a vehicle")
    void updateVehicle_notOwner() {
        when(vehicleRepository.findById(10L)).thenReturn(Optional.of(alicesCar()));

        assertThatThrownBy(() -> service.updateVehicle(10L, new UpdateVehicleRequest("van", null, null), BOB))
                .isInstanceOf(ForbiddenException.class);
        verify(vehicleRepository, never()).save(any());
    }

    @Test
    @DisplayName("a vehicle with a pending or approved request cannot be deleted")
    void deleteVehicle_activeRequest() {
        when(vehicleRepository.findByIdWithLock(10L)).thenReturn(Optional.of(alicesCar()));
        when(requestRepository.countByVehicleIdAndRequestStatusIn(10L, RequestStatus.ACTIVE)).thenReturn(1L);

        assertThatThrownBy(() -> service.deleteVehicle(10L, ALICE))
                .isInstanceOf(ConflictException.class)
                .hasMessageStartingWith("Cannot delete vehicle with active or approved parking requests.");
        verify(vehicleRepository, never()).delete(any());
    }

    @Test
    @DisplayName("a vehicle with only resolved requests is deleted")
    void deleteVehicle_success() {
        Vehicle car = alicesCar();
        when(vehicleRepository.findByIdWithLock(10L)).thenReturn(Optional.of(car));
        when(requestRepository.countByVehicleIdAndRequestStatusIn(10L, RequestStatus.ACTIVE)).thenReturn(0L);

        service.deleteVehicle(10L, ALICE);

        verify(vehicleRepository).delete(car);
        verify(actionLogService).record(eq(AuditAction.VEHICLE_DELETED), eq(1L), anyMap());
    }
}
