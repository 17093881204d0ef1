package com.adlab.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Insert-and-read access to the audit trail. Deliberately not a {@code JpaRepository}: no update
 * or delete method is exposed.
 */
public interface AuditLogRepository extends Repository<AuditLog, UUID> {

    AuditLog save(AuditLog entry);

    List<AuditLog> findByWorkspaceIdAndEntityTypeAndEntityIdOrderByCreatedAtAsc(UUID workspaceId,
                                                                               AuditEntityType entityType,
                                                                               String entityId);

    List<AuditLog> findByWorkspaceIdOrderByCreatedAtAsc(UUID workspaceId);

    @Query(value = """
            select a from AuditLog a
             where a.workspaceId = :workspaceId
               and (:action is null or a.action = :action)
               and (:entityType is null or a.entityType = :entityType)
               and (:entityId is null or a.entityId = :entityId)
               and (:from is null or a.createdAt >= :from)
               and (:to is null or a.createdAt < :to)
             order by a.createdAt desc
            """,
            countQuery = """
            select count(a) from AuditLog a
             where a.workspaceId = :workspaceId
               and (:action is null or a.action = :action)
               and (:entityType is null or a.entityType = :entityType)
               and (:entityId is null or a.entityId = :entityId)
               and (:from is null or a.createdAt >= :from)
               and (:to is null or a.createdAt < :to)
            """)
    Page<AuditLog> search(
            @Param("workspaceId") UUID workspaceId,
            @Param("action") AuditAction action,
            @Param("entityType") AuditEntityType entityType,
            @Param("entityId") String entityId,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to,
            Pageable pageable
    );
}
