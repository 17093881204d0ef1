package com.adlab.backend.modules.snapshot.presentation;

import java.util.List;
import java.util.UUID;

import com.adlab.backend.modules.snapshot.application.SnapshotQueryService;
import com.adlab.backend.modules.snapshot.presentation.dto.ActiveIngestionLogResponse;
import com.adlab.backend.modules.snapshot.presentation.dto.SnapshotResponse;
import com.adlab.backend.modules.workspace.application.ActorResolver;
import com.adlab.backend.modules.workspace.domain.Actor;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/snapshots")
public class SnapshotController {

    private final SnapshotQueryService snapshotQueryService;
    private final ActorResolver actorResolver;

    public SnapshotController(SnapshotQueryService snapshotQueryService, ActorResolver actorResolver) {
        this.snapshotQueryService = snapshotQueryService;
        this.actorResolver = actorResolver;
    }

    @Operation(summary = "Active snapshot for a data key")
    @GetMapping("/active")
    public ResponseEntity<SnapshotResponse> getActive(
            @RequestParam String platform,
            @RequestParam String dataset
    ) {
        Actor actor = actorResolver.resolveCurrentActor();
        return ResponseEntity.ok(SnapshotResponse.from(snapshotQueryService.getActiveSnapshot(actor, platform, dataset)));
    }

    @Operation(summary = "Ingestion log backing the active snapshot", description = "Anchor for read-only analytics; null when nothing is promoted.")
    @GetMapping("/active/ingestion-log")
    public ResponseEntity<ActiveIngestionLogResponse> getActiveIngestionLog(
            @RequestParam String platform,
            @RequestParam String dataset
    ) {
        Actor actor = actorResolver.resolveCurrentActor();
        UUID ingestionLogId = snapshotQueryService.resolveActiveIngestionLogId(actor, platform, dataset).orElse(null);
        return ResponseEntity.ok(new ActiveIngestionLogResponse(platform, dataset, ingestionLogId));
    }

    @Operation(summary = "Snapshot history for a data key", description = "Newest first.")
    @GetMapping("/history")
    public ResponseEntity<List<SnapshotResponse>> getHistory(
            @RequestParam String platform,
            @RequestParam String dataset,
            @RequestParam(required = false) Integer limit
    ) {
        Actor actor = actorResolver.resolveCurrentActor();
        List<SnapshotResponse> history = snapshotQueryService.getHistory(actor, platform, dataset, limit).stream()
                .map(SnapshotResponse::from)
                .toList();
        return ResponseEntity.ok(history);
    }

    @Operation(summary = "Single snapshot")
    @GetMapping("/{snapshotId}")
    public ResponseEntity<SnapshotResponse> getSnapshot(@PathVariable UUID snapshotId) {
        Actor actor = actorResolver.resolveCurrentActor();
        return ResponseEntity.ok(SnapshotResponse.from(snapshotQueryService.getSnapshot(actor, snapshotId)));
    }
}
