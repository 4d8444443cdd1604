package com.openparking.parking.events;

import com.openparking.parking.domain.model.AuditAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published inside a lifecycle transaction; handled once that transaction has committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotRequestEvent {
    private Type type;
    private Long requestId;
    /** Owner of the request. */
    private Long userId;
    private Long vehicleId;
    /** User who performed the transition (the owner, or an administrator). */
    private Long actorId;
    private Long slotId;
    private String slotNumber;
    private String reason;
    private Instant timestamp;

    public enum Type {
        CREATED(AuditAction.SLOT_REQUEST_CREATED),
        UPDATED(AuditAction.SLOT_REQUEST_UPDATED_BY_USER),
        CANCELLED(AuditAction.SLOT_REQUEST_CANCELLED_BY_USER),
        APPROVED(AuditAction.SLOT_REQUEST_APPROVED),
        REJECTED(AuditAction.SLOT_REQUEST_REJECTED);

        private final AuditAction auditAction;

        Type(AuditAction auditAction) {
            this.auditAction = auditAction;
        }

        public AuditAction auditAction() {
            return auditAction;
        }

        public boolean notifiesRequester() {
            return this == APPROVED || this == REJECTED;
        }
    }
}
