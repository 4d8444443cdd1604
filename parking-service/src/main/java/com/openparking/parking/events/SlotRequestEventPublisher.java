package com.openparking.parking.events;

import com.openparking.parking.domain.model.SlotRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Publishes slot request lifecycle events.
 *
 * Events are delivered to {@link SlotRequestEventListener} after the surrounding transaction
 * commits, so a rolled-back transition is neither audited nor announced to the requester.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotRequestEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(SlotRequestEvent.Type type, SlotRequest request, Long actorId) {
        publish(type, request, actorId, null);
    }

    public void publish(SlotRequestEvent.Type type, SlotRequest request, Long actorId, String reason) {
        SlotRequestEvent event = SlotRequestEvent.builder()
                .type(type)
                .requestId(request.getId())
                .userId(request.getUserId())
                .vehicleId(request.getVehicleId())
                .actorId(actorId)
                .slotId(request.getSlotId())
                .slotNumber(request.getAssignedSlotNumber())
                .reason(reason)
                .timestamp(Instant.now())
                .build();
        log.debug("Publishing {} event for slot request {}", type, request.getId());
        applicationEventPublisher.publishEvent(event);
    }
}
