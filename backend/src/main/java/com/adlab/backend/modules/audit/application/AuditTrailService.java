package com.adlab.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.List;

import com.adlab.backend.global.config.GovernanceProperties;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditLog;
import com.adlab.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.adlab.backend.modules.governance.application.PermissionGate;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the audit trail, always confined to the actor's workspace.
 */
@Service
@Transactional(readOnly = true)
public class AuditTrailService {

    private final AuditLogRepository auditLogRepository;
    private final PermissionGate permissionGate;
    private final GovernanceProperties properties;

    public AuditTrailService(
            AuditLogRepository auditLogRepository,
            PermissionGate permissionGate,
            GovernanceProperties properties
    ) {
        this.auditLogRepository = auditLogRepository;
        this.permissionGate = permissionGate;
        this.properties = properties;
    }

    public Page<AuditLog> search(Actor actor, AuditTrailQuery query) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        int size = Math.max(1, Math.min(query.size(), properties.audit().maxPageSize()));
        return auditLogRepository.search(
                actor.workspaceId(),
                query.action(),
                query.entityType(),
                query.entityId(),
                query.from(),
                query.to(),
                PageRequest.of(Math.max(0, query.page()), size)
        );
    }

    /**
     * Entries for one entity in the order they were written.
     */
    public List<AuditLog> entityTrail(Actor actor, AuditEntityType entityType, String entityId) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        return auditLogRepository.findByWorkspaceIdAndEntityTypeAndEntityIdOrderByCreatedAtAsc(
                actor.workspaceId(), entityType, entityId);
    }

    public record AuditTrailQuery(
            AuditAction action,
            AuditEntityType entityType,
            String entityId,
            OffsetDateTime from,
            OffsetDateTime to,
            int page,
            int size
    ) {
    }
}
