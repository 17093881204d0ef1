package com.adlab.backend.modules.governance.presentation;

import com.adlab.backend.modules.governance.application.GovernanceOrchestrator;
import com.adlab.backend.modules.governance.presentation.dto.PromoteRequest;
import com.adlab.backend.modules.governance.presentation.dto.PromoteResponse;
import com.adlab.backend.modules.governance.presentation.dto.RollbackRequest;
import com.adlab.backend.modules.governance.presentation.dto.RollbackResponse;
import com.adlab.backend.modules.snapshot.application.PromotionResult;
import com.adlab.backend.modules.snapshot.application.RollbackResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/governance")
public class GovernanceController {

    private final GovernanceOrchestrator governanceOrchestrator;

    public GovernanceController(GovernanceOrchestrator governanceOrchestrator) {
        this.governanceOrchestrator = governanceOrchestrator;
    }

    @Operation(summary = "Promote an ingestion log", description = "Turns a validated ingestion log into the active production snapshot for its key.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Snapshot promoted and audited"),
            @ApiResponse(responseCode = "403", description = "Permission denied or target in another workspace"),
            @ApiResponse(responseCode = "404", description = "Ingestion log not found"),
            @ApiResponse(responseCode = "409", description = "Concurrent change to the same key"),
            @ApiResponse(responseCode = "422", description = "Log frozen, failed, or without valid rows"),
            @ApiResponse(responseCode = "500", description = "Operation failed, or promoted but not audited"),
            @ApiResponse(responseCode = "503", description = "Kill switch active")
    })
    @PostMapping("/promotions")
    public ResponseEntity<PromoteResponse> promote(@Valid @RequestBody PromoteRequest request) {
        PromotionResult result = governanceOrchestrator.promote(request.ingestionLogId());
        return ResponseEntity.status(HttpStatus.CREATED).body(new PromoteResponse(result.snapshot().getId()));
    }

    @Operation(summary = "Roll back to a snapshot", description = "Reactivates an inactive snapshot. Owner only, reason required.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rolled back and audited"),
            @ApiResponse(responseCode = "403", description = "Permission denied or snapshot in another workspace"),
            @ApiResponse(responseCode = "404", description = "Snapshot not found"),
            @ApiResponse(responseCode = "409", description = "Snapshot already active or concurrent change"),
            @ApiResponse(responseCode = "422", description = "Reason missing"),
            @ApiResponse(responseCode = "500", description = "Operation failed, or rolled back but not audited"),
            @ApiResponse(responseCode = "503", description = "Kill switch active")
    })
    @PostMapping("/rollbacks")
    public ResponseEntity<RollbackResponse> rollback(@Valid @RequestBody RollbackRequest request) {
        RollbackResult result = governanceOrchestrator.rollback(request.snapshotId(), request.reason());
        return ResponseEntity.ok(new RollbackResponse(result.activated().getId(), result.previousSnapshotId()));
    }
}
