package com.adlab.backend.support;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.adlab.backend.modules.auth.application.JwtTokenService;
import com.adlab.backend.modules.safety.domain.KillSwitch;
import com.adlab.backend.modules.safety.domain.KillSwitchScope;
import com.adlab.backend.modules.safety.infrastructure.persistence.KillSwitchRepository;
import com.adlab.backend.modules.snapshot.domain.IngestionLog;
import com.adlab.backend.modules.snapshot.domain.IngestionStatus;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.IngestionLogRepository;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceMembership;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;
import com.adlab.backend.modules.workspace.infrastructure.persistence.WorkspaceMembershipRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestWorkspaceFactory {

    private final WorkspaceMembershipRepository membershipRepository;
    private final IngestionLogRepository ingestionLogRepository;
    private final KillSwitchRepository killSwitchRepository;
    private final JwtTokenService jwtTokenService;

    public TestWorkspaceFactory(
            WorkspaceMembershipRepository membershipRepository,
            IngestionLogRepository ingestionLogRepository,
            KillSwitchRepository killSwitchRepository,
            JwtTokenService jwtTokenService
    ) {
        this.membershipRepository = membershipRepository;
        this.ingestionLogRepository = ingestionLogRepository;
        this.killSwitchRepository = killSwitchRepository;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * Flips the seeded global row the way an operator would; there is no HTTP route for it.
     */
    public void enableGlobalKillSwitch(String reason) {
        KillSwitch global = killSwitchRepository.findApplicable(UUID.randomUUID()).stream()
                .filter(killSwitch -> killSwitch.getScope() == KillSwitchScope.GLOBAL)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Global kill switch row is missing"));
        global.enable(reason, UUID.randomUUID(), OffsetDateTime.now(ZoneOffset.UTC));
    }

    public Actor member(UUID workspaceId, WorkspaceRole role) {
        WorkspaceMembership membership = new WorkspaceMembership();
        membership.setWorkspaceId(workspaceId);
        membership.setUserId(UUID.randomUUID());
        membership.setRole(role);
        return membershipRepository.save(membership).toActor();
    }

    public IngestionLog validatedLog(UUID workspaceId, String platform, String dataset) {
        return ingestionLog(workspaceId, platform, dataset, IngestionStatus.PASS, 100);
    }

    public IngestionLog ingestionLog(UUID workspaceId, String platform, String dataset, IngestionStatus status,
                                     int validRows) {
        IngestionLog log = new IngestionLog();
        log.setWorkspaceId(workspaceId);
        log.setPlatform(platform);
        log.setDataset(dataset);
        log.setFileName(platform + "_" + dataset + ".csv");
        log.setStatus(status);
        log.setValidRows(validRows);
        return ingestionLogRepository.save(log);
    }

    public String bearer(Actor actor) {
        return "Bearer " + jwtTokenService.issueAccessToken(actor.id(), actor.workspaceId());
    }
}
