package com.adlab.backend.modules.safety.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.modules.safety.domain.KillSwitch;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface KillSwitchRepository extends JpaRepository<KillSwitch, UUID> {

    /**
     * Global row plus the workspace row, if any, in a single read.
     */
    @Query("""
            select k from KillSwitch k
             where k.scope = com.adlab.backend.modules.safety.domain.KillSwitchScope.GLOBAL
                or (k.scope = com.adlab.backend.modules.safety.domain.KillSwitchScope.WORKSPACE
                    and k.workspaceId = :workspaceId)
            """)
    List<KillSwitch> findApplicable(@Param("workspaceId") UUID workspaceId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select k from KillSwitch k
             where k.scope = com.adlab.backend.modules.safety.domain.KillSwitchScope.WORKSPACE
               and k.workspaceId = :workspaceId
            """)
    Optional<KillSwitch> findWorkspaceForUpdate(@Param("workspaceId") UUID workspaceId);
}
