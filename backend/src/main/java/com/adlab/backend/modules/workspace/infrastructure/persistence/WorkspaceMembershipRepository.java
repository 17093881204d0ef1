package com.adlab.backend.modules.workspace.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.modules.workspace.domain.WorkspaceMembership;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkspaceMembershipRepository extends JpaRepository<WorkspaceMembership, UUID> {

    Optional<WorkspaceMembership> findByWorkspaceIdAndUserIdAndActiveTrue(UUID workspaceId, UUID userId);

    @Query("""
            select m from WorkspaceMembership m
             where m.userId = :userId
               and m.active = true
             order by m.createdAt desc
            """)
    List<WorkspaceMembership> findActiveByUserId(@Param("userId") UUID userId);
}
