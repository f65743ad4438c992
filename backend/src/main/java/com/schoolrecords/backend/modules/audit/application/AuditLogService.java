package com.schoolrecords.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.audit.domain.AuditLog;
import com.schoolrecords.backend.modules.audit.infrastructure.AuditLogRepository;

/**
 * Appends one row per privileged mutation. Runs in the caller's transaction so
 * the audit entry commits or rolls back together with the change it describes.
 * The actor is the token subject of the current request, or null outside HTTP.
 */
@Service
public class AuditLogService {

    public static final String RESOURCE_STUDENT = "STUDENT";
    public static final String RESOURCE_COURSE = "COURSE";
    public static final String RESOURCE_ENROLLMENT = "ENROLLMENT";
    public static final String RESOURCE_ATTENDANCE = "ATTENDANCE";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActor(SecurityUtils.findCurrentSubject().orElse(null));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));
        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new LinkedHashMap<>(command.detail()));
        }
        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            Map<String, Object> detail
    ) {
    }
}
