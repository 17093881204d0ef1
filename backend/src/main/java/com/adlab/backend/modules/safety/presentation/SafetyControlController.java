package com.adlab.backend.modules.safety.presentation;

import java.util.List;

import com.adlab.backend.modules.safety.application.FailureInjectionService;
import com.adlab.backend.modules.safety.application.FailureInjectionService.FailureInjectionCommand;
import com.adlab.backend.modules.safety.application.KillSwitchService;
import com.adlab.backend.modules.safety.domain.KillSwitch;
import com.adlab.backend.modules.safety.presentation.dto.FailureInjectionRequest;
import com.adlab.backend.modules.safety.presentation.dto.FailureInjectionResponse;
import com.adlab.backend.modules.safety.presentation.dto.KillSwitchResponse;
import com.adlab.backend.modules.safety.presentation.dto.KillSwitchStatusResponse;
import com.adlab.backend.modules.safety.presentation.dto.KillSwitchToggleRequest;
import com.adlab.backend.modules.workspace.application.ActorResolver;
import com.adlab.backend.modules.workspace.domain.Actor;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/governance")
public class SafetyControlController {

    private final KillSwitchService killSwitchService;
    private final FailureInjectionService failureInjectionService;
    private final ActorResolver actorResolver;

    public SafetyControlController(
            KillSwitchService killSwitchService,
            FailureInjectionService failureInjectionService,
            ActorResolver actorResolver
    ) {
        this.killSwitchService = killSwitchService;
        this.failureInjectionService = failureInjectionService;
        this.actorResolver = actorResolver;
    }

    @Operation(summary = "Kill switch status", description = "Global and workspace switches that apply to the caller's workspace.")
    @GetMapping("/kill-switch")
    public ResponseEntity<KillSwitchStatusResponse> getKillSwitchStatus() {
        Actor actor = actorResolver.resolveCurrentActor();
        return ResponseEntity.ok(KillSwitchStatusResponse.from(killSwitchService.getStatus(actor)));
    }

    @Operation(summary = "Toggle the workspace kill switch", description = "Owner only. A reason is required when enabling. The global switch is not reachable here.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Switch updated and audited"),
            @ApiResponse(responseCode = "403", description = "Owner role required"),
            @ApiResponse(responseCode = "422", description = "Reason missing")
    })
    @PostMapping("/kill-switch")
    public ResponseEntity<KillSwitchResponse> toggleKillSwitch(@Valid @RequestBody KillSwitchToggleRequest request) {
        Actor actor = actorResolver.resolveCurrentActor();
        KillSwitch updated = killSwitchService.setWorkspace(actor, request.enabled(), request.reason());
        return ResponseEntity.ok(KillSwitchResponse.from(updated));
    }

    @Operation(summary = "Failure injection configs of the workspace", description = "Owner only.")
    @GetMapping("/failure-injections")
    public ResponseEntity<List<FailureInjectionResponse>> listFailureInjections() {
        Actor actor = actorResolver.resolveCurrentActor();
        List<FailureInjectionResponse> configs = failureInjectionService.listConfigs(actor).stream()
                .map(FailureInjectionResponse::from)
                .toList();
        return ResponseEntity.ok(configs);
    }

    @Operation(summary = "Create or update a failure injection config", description = "Owner only. One config per action.")
    @PutMapping("/failure-injections")
    public ResponseEntity<FailureInjectionResponse> configureFailureInjection(
            @Valid @RequestBody FailureInjectionRequest request
    ) {
        Actor actor = actorResolver.resolveCurrentActor();
        FailureInjectionCommand command = new FailureInjectionCommand(
                request.action(),
                request.failureType(),
                request.probability(),
                request.enabled(),
                request.reason()
        );
        return ResponseEntity.ok(FailureInjectionResponse.from(failureInjectionService.configure(actor, command)));
    }
}
