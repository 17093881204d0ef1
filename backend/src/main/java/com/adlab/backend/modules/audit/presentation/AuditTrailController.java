package com.adlab.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.util.List;

import com.adlab.backend.modules.audit.application.AuditTrailService;
import com.adlab.backend.modules.audit.application.AuditTrailService.AuditTrailQuery;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditLog;
import com.adlab.backend.modules.audit.presentation.dto.AuditLogResponse;
import com.adlab.backend.modules.audit.presentation.dto.AuditTrailResponse;
import com.adlab.backend.modules.workspace.application.ActorResolver;
import com.adlab.backend.modules.workspace.domain.Actor;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit")
public class AuditTrailController {

    private final AuditTrailService auditTrailService;
    private final ActorResolver actorResolver;

    public AuditTrailController(AuditTrailService auditTrailService, ActorResolver actorResolver) {
        this.auditTrailService = auditTrailService;
        this.actorResolver = actorResolver;
    }

    @Operation(summary = "Search the workspace audit trail", description = "Newest first; every filter is optional.")
    @GetMapping
    public ResponseEntity<AuditTrailResponse> search(
            @RequestParam(required = false) AuditAction action,
            @RequestParam(required = false) AuditEntityType entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        Actor actor = actorResolver.resolveCurrentActor();
        Page<AuditLog> result = auditTrailService.search(actor,
                new AuditTrailQuery(action, entityType, entityId, from, to, page, size));
        List<AuditLogResponse> items = result.getContent().stream().map(AuditLogResponse::from).toList();
        return ResponseEntity.ok(new AuditTrailResponse(items, result.getNumber(), result.getSize(), result.getTotalElements()));
    }

    @Operation(summary = "Audit trail of one entity", description = "Oldest first.")
    @GetMapping("/entities/{entityType}/{entityId}")
    public ResponseEntity<List<AuditLogResponse>> entityTrail(
            @PathVariable AuditEntityType entityType,
            @PathVariable String entityId
    ) {
        Actor actor = actorResolver.resolveCurrentActor();
        List<AuditLogResponse> trail = auditTrailService.entityTrail(actor, entityType, entityId).stream()
                .map(AuditLogResponse::from)
                .toList();
        return ResponseEntity.ok(trail);
    }
}
