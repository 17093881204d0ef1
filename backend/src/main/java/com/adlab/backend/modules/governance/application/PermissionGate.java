package com.adlab.backend.modules.governance.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.governance.domain.GovernedTarget;
import com.adlab.backend.modules.governance.domain.PermissionDeniedException;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Role-to-action authorization over {@link GovernedAction#minimumRole()}.
 */
@Component
public class PermissionGate {

    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    private final AuditLogService auditLogService;

    public PermissionGate(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    public static boolean canPerform(WorkspaceRole role, GovernedAction action) {
        return role != null && action != null && role.isAtLeast(action.minimumRole());
    }

    /**
     * Fails without recording anything. Used for reads.
     */
    public void requirePermission(Actor actor, GovernedAction action) {
        if (!canPerform(actor.role(), action)) {
            throw new PermissionDeniedException(action, actor.role());
        }
    }

    /**
     * Fails and records the attempt against {@code target}, so probing for permissions leaves a
     * trail.
     */
    public void requirePermissionAudited(Actor actor, GovernedAction action, GovernedTarget target) {
        Objects.requireNonNull(target, "target");
        if (canPerform(actor.role(), action)) {
            return;
        }
        PermissionDeniedException denied = new PermissionDeniedException(action, actor.role());
        log.warn("Permission denied: actor={} role={} action={} workspace={}",
                actor.id(), actor.role(), action, actor.workspaceId());
        recordDenial(actor, action, target);
        throw denied;
    }

    private void recordDenial(Actor actor, GovernedAction action, GovernedTarget target) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("attemptedAction", action.name());
        metadata.put("requiredRole", action.minimumRole().name());
        metadata.put("actorRole", actor.role().name());

        try {
            auditLogService.append(new AuditEntryCommand(actor, AuditAction.PERMISSION_DENIED,
                    target.entityType(), target.entityId().toString(), target.scope(), null, metadata));
        } catch (AuditWriteException ex) {
            // the denial itself is still returned to the caller
            log.error("Could not record permission denial for actor={} action={}", actor.id(), action, ex);
        }
    }
}
