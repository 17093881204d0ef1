package com.adlab.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

import com.adlab.backend.global.web.RequestIdFilter;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditLog;
import com.adlab.backend.modules.audit.domain.AuditScope;
import com.adlab.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Appends audit entries. Each append runs in its own transaction so that an entry
 * survives or fails independently of whatever the caller is doing.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate writeTemplate;
    private final Clock clock;

    public AuditLogService(
            AuditLogRepository auditLogRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.auditLogRepository = auditLogRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Records one entry and returns it with its generated id.
     *
     * @throws AuditWriteException when the entry is malformed or storage rejects it
     */
    public AuditLog append(AuditEntryCommand command) {
        Objects.requireNonNull(command, "command");
        validate(command);

        Actor actor = command.actor();
        AuditLog entry = new AuditLog(
                actor.workspaceId(),
                actor.id(),
                actor.role(),
                command.action(),
                command.entityType(),
                command.entityId(),
                command.scope(),
                command.reason() == null ? null : command.reason().trim(),
                command.metadata(),
                RequestIdFilter.currentRequestId().orElse(null),
                OffsetDateTime.now(clock)
        );

        try {
            return writeTemplate.execute(status -> auditLogRepository.save(entry));
        } catch (DataAccessException | TransactionException ex) {
            log.error("Audit write failed for {} on {}:{} - {}", command.action(), command.entityType(),
                    command.entityId(), ex.getMessage(), ex);
            throw new AuditWriteException("Audit entry for " + command.action() + " could not be written", ex);
        }
    }

    private void validate(AuditEntryCommand command) {
        if (command.actor() == null) {
            throw new AuditWriteException("Audit context is missing the actor");
        }
        if (command.action() == null || command.entityType() == null) {
            throw new AuditWriteException("Audit entry requires an action and an entity type");
        }
        if (command.entityId() == null || command.entityId().isBlank()) {
            throw new AuditWriteException("Audit entry for " + command.action() + " requires an entity id");
        }
        if (command.action().requiresReason() && (command.reason() == null || command.reason().isBlank())) {
            throw new AuditWriteException(command.action() + " audit entries require a reason");
        }
    }

    public record AuditEntryCommand(
            Actor actor,
            AuditAction action,
            AuditEntityType entityType,
            String entityId,
            AuditScope scope,
            String reason,
            Map<String, Object> metadata
    ) {
    }
}
