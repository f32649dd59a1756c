package com.rentdesk.backend.services;

import com.rentdesk.backend.entities.AuditEvent;
import com.rentdesk.backend.enums.AuditEventStatus;
import com.rentdesk.backend.repositories.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditEventRepository auditEventRepository;

    @Async("auditTaskExecutor")
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logEvent(AuditEvent event) {
        try {
            auditEventRepository.save(event);
        } catch (DataAccessException e) {
            log.error("[Audit] failed to store audit event {} {}", event.getAction(), event.getEntityId(), e);
        }
    }

    public AuditEvent createEvent(
            String actor,
            String ipAddress,
            String action,
            String entityId,
            String entityType,
            Map<String, Object> details,
            AuditEventStatus status
    ) {
        return AuditEvent.builder()
                .actor(actor)
                .ipAddress(ipAddress)
                .action(action)
                .entityId(entityId)
                .entityType(entityType)
                .details(details)
                .status(status)
                .build();
    }
}
