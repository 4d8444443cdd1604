package com.openparking.parking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openparking.parking.domain.model.ActionLog;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.repository.ActionLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Append-only audit trail.
 *
 * The entry is built and timestamped on the caller's thread, then written on the audit executor
 * with its own connection and transaction. The caller never waits for the insert and never holds
 * a second pooled connection. Failures, including a full executor queue, are logged and swallowed.
 */
@Slf4j
@Service
public class ActionLogService {

    private final ActionLogRepository actionLogRepository;
    private final ObjectMapper objectMapper;
    private final TaskExecutor auditExecutor;

    public ActionLogService(ActionLogRepository actionLogRepository,
                            ObjectMapper objectMapper,
                            @Qualifier("auditExecutor") TaskExecutor auditExecutor) {
        this.actionLogRepository = actionLogRepository;
        this.objectMapper = objectMapper;
        this.auditExecutor = auditExecutor;
    }

    public void record(AuditAction action, Long actorId) {
        record(action, actorId, null);
    }

    /**
     * @param actorId user performing the action, or null (e.g. a failed login)
     * @param details optional structured payload, stored as JSON
     */
    public void record(AuditAction action, Long actorId, Map<String, ?> details) {
        try {
            ActionLog entry = ActionLog.builder()
                    .action(action.name())
                    .userId(actorId)
                    .details(toJson(details))
                    .timestamp(LocalDateTime.now())
                    .build();
            auditExecutor.execute(() -> write(entry));
        } catch (Exception e) {
            log.warn("Failed to record action {} by user {} (non-fatal)", action, actorId, e);
        }
    }

    private void write(ActionLog entry) {
        try {
            actionLogRepository.save(entry);
            log.debug("Recorded action {} by user {}", entry.getAction(), entry.getUserId());
        } catch (Exception e) {
            log.warn("Failed to write action {} by user {} (non-fatal)", entry.getAction(), entry.getUserId(), e);
        }
    }

    private String toJson(Map<String, ?> details) throws JsonProcessingException {
        if (details == null || details.isEmpty()) {
            return null;
        }
        return objectMapper.writeValueAsString(details);
    }
}
