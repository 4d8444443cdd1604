package com.openparking.parking.events;

import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.model.Vehicle;
import com.openparking.parking.domain.repository.ParkingSlotRepository;
import com.openparking.parking.domain.repository.UserRepository;
import com.openparking.parking.domain.repository.VehicleRepository;
import com.openparking.parking.domain.service.ActionLogService;
import com.openparking.parking.notification.NotificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlotRequestEventListenerTest {

    @Mock
    private ActionLogService actionLogService;
    @Mock
    private NotificationService notificationService;
    @Mock
    private UserRepository userRepository;
    @Mock
    private VehicleRepository vehicleRepository;
    @Mock
    private ParkingSlotRepository slotRepository;

    @InjectMocks
    private SlotRequestEventListener listener;

    private static SlotRequestEvent event(SlotRequestEvent.Type type) {
        return SlotRequestEvent.builder()
                .type(type).requestId(100L).userId(1L).vehicleId(10L).actorId(99L)
                .timestamp(Instant.now())
                .build();
    }

    private void requesterExists() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(
                User.builder().id(1L).name("Alice").email("alice@example.com").role(Role.USER).build()));
        when(vehicleRepository.findById(10L)).thenReturn(Optional.of(
                Vehicle.builder().id(10L).plateNumber("AB-123").build()));
    }

    @Test
    @DisplayName("approval is audited under the admin and mailed to the requester with the slot")
    void approved_auditAndMail() {
        SlotRequestEvent approved = event(SlotRequestEvent.Type.APPROVED);
        approved.setSlotId(7L);
        approved.setSlotNumber("A1");
        requesterExists();
        when(slotRepository.findById(7L)).thenReturn(Optional.of(
                ParkingSlot.builder().id(7L).slotNumber("A1").location("Level 1").build()));

        listener.onSlotRequestEvent(approved);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(actionLogService).record(eq(AuditAction.SLOT_REQUEST_APPROVED), eq(99L), details.capture());
        assertThat(details.getValue()).containsEntry("requestId", 100L).containsEntry("slotId", 7L);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationService).send(eq("alice@example.com"), eq("Parking Slot Approved!"), body.capture());
        assertThat(body.getValue()).contains("AB-123").contains("A1").contains("Level 1");
    }

    @Test
    @DisplayName("rejection mail carries the reason")
    void rejected_mailWithReason() {
        SlotRequestEvent rejected = event(SlotRequestEvent.Type.REJECTED);
        rejected.setReason("Lot full");
        requesterExists();

        listener.onSlotRequestEvent(rejected);

        verify(actionLogService).record(eq(AuditAction.SLOT_REQUEST_REJECTED), eq(99L), anyMap());
        verify(notificationService).send(eq("alice@example.com"), eq("Parking Slot Request Rejected"),
                contains("Reason: Lot full"));
    }

    @Test
    @DisplayName("user-side transitions are audited but not mailed")
    void created_auditOnly() {
        listener.onSlotRequestEvent(event(SlotRequestEvent.Type.CREATED));

        verify(actionLogService).record(eq(AuditAction.SLOT_REQUEST_CREATED), eq(99L), anyMap());
        verifyNoInteractions(notificationService, userRepository);
    }

    @Test
    @DisplayName("a requester that no longer exists gets no mail")
    void approved_requesterGone_noMail() {
        when(userRepository.findById(1L)).thenReturn(Optional.empty());

        listener.onSlotRequestEvent(event(SlotRequestEvent.Type.APPROVED));

        verify(notificationService, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("a lookup failure while preparing the mail does not escape the listener")
    void lookupFails_swallowed() {
        when(userRepository.findById(1L)).thenThrow(new IllegalStateException("connection reset"));

        assertThatCode(() -> listener.onSlotRequestEvent(event(SlotRequestEvent.Type.REJECTED)))
                .doesNotThrowAnyException();
        verify(actionLogService).record(any(), any(), anyMap());
    }
}
