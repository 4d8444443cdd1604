package com.openparking.parking.events;

import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.model.Vehicle;
import com.openparking.parking.domain.repository.ParkingSlotRepository;
import com.openparking.parking.domain.repository.UserRepository;
import com.openparking.parking.domain.repository.VehicleRepository;
import com.openparking.parking.domain.service.ActionLogService;
import com.openparking.parking.notification.MailMessage;
import com.openparking.parking.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Post-commit side effects of the slot request lifecycle: the audit record and,
 * for approvals and rejections, an email to the requester.
 * Neither can affect the outcome of the transition that triggered them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotRequestEventListener {

    private final ActionLogService actionLogService;
    private final NotificationService notificationService;
    private final UserRepository userRepository;
    private final VehicleRepository vehicleRepository;
    private final ParkingSlotRepository slotRepository;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSlotRequestEvent(SlotRequestEvent event) {
        actionLogService.record(event.getType().auditAction(), event.getActorId(), auditDetails(event));
        if (event.getType().notifiesRequester()) {
            try {
                notifyRequester(event);
            } catch (Exception e) {
                log.warn("Could not prepare {} notification for slot request {} (non-fatal)",
                        event.getType(), event.getRequestId(), e);
            }
        }
    }

    private void notifyRequester(SlotRequestEvent event) {
        Optional<User> requester = userRepository.findById(event.getUserId());
        if (requester.isEmpty()) {
            log.warn("Requester {} of slot request {} no longer exists, skipping notification",
                    event.getUserId(), event.getRequestId());
            return;
        }
        User user = requester.get();
        String plate = vehicleRepository.findById(event.getVehicleId())
                .map(Vehicle::getPlateNumber)
                .orElse("#" + event.getVehicleId());

        MailMessage message;
        if (event.getType() == SlotRequestEvent.Type.APPROVED) {
            String location = event.getSlotId() == null ? null
                    : slotRepository.findById(event.getSlotId()).map(ParkingSlot::getLocation).orElse(null);
            message = MailMessage.slotApproved(user.getName(), plate, event.getSlotNumber(), location);
        } else {
            message = MailMessage.slotRejected(user.getName(), plate, event.getReason());
        }
        notificationService.send(user.getEmail(), message.subject(), message.body());
    }

    private Map<String, Object> auditDetails(SlotRequestEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestId", event.getRequestId());
        details.put("vehicleId", event.getVehicleId());
        if (event.getSlotId() != null) {
            details.put("slotId", event.getSlotId());
        }
        if (event.getReason() != null) {
            details.put("reason", event.getReason());
        }
        return details;
    }
}
