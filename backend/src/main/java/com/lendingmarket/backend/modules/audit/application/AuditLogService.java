package com.lendingmarket.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.lendingmarket.backend.global.web.RequestIdFilter;
import com.lendingmarket.backend.modules.audit.domain.AuditLog;
import com.lendingmarket.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes audit entries inside the caller's transaction, so a rolled-back transition leaves no trace.
 */
@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());

        if (command.actorUserId() != null) {
            auditLog.setActor(entityManager.getReference(UserAccount.class, command.actorUserId()));
        }

        auditLog.setCorrelationId(RequestIdFilter.currentRequestId());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new LinkedHashMap<>(command.detail()));
        }
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            Map<String, Object> detail
    ) {
    }
}
