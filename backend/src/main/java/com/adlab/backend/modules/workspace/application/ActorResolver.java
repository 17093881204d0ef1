package com.adlab.backend.modules.workspace.application;

import java.util.List;
import java.util.UUID;

import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.security.JwtAuthenticationPrincipal;
import com.adlab.backend.global.security.SecurityUtils;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceMembership;
import com.adlab.backend.modules.workspace.infrastructure.persistence.WorkspaceMembershipRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns the authenticated principal into an {@link Actor} using the caller's active membership.
 * When the token names a workspace that membership is required; otherwise the most recent active
 * membership is used.
 */
@Service
@Transactional(readOnly = true)
public class ActorResolver {

    private final WorkspaceMembershipRepository membershipRepository;

    public ActorResolver(WorkspaceMembershipRepository membershipRepository) {
        this.membershipRepository = membershipRepository;
    }

    public Actor resolveCurrentActor() {
        JwtAuthenticationPrincipal principal = SecurityUtils.findCurrentPrincipal()
                .orElseThrow(GovernanceException::notAuthenticated);
        return resolve(principal.userId(), principal.workspaceId());
    }

    public Actor resolve(UUID userId, UUID requestedWorkspaceId) {
        if (userId == null) {
            throw GovernanceException.notAuthenticated();
        }
        if (requestedWorkspaceId != null) {
            return membershipRepository.findByWorkspaceIdAndUserIdAndActiveTrue(requestedWorkspaceId, userId)
                    .map(WorkspaceMembership::toActor)
                    .orElseThrow(() -> GovernanceException.noMembership(
                            "No active membership in workspace " + requestedWorkspaceId));
        }
        List<WorkspaceMembership> memberships = membershipRepository.findActiveByUserId(userId);
        if (memberships.isEmpty()) {
            throw GovernanceException.noMembership("No active workspace membership");
        }
        return memberships.get(0).toActor();
    }
}
