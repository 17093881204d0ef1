package com.adlab.backend.modules.safety.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.safety.domain.FailureInjectionConfig;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FailureInjectionConfigRepository extends JpaRepository<FailureInjectionConfig, UUID> {

    Optional<FailureInjectionConfig> findByWorkspaceIdAndActionAndEnabledTrue(UUID workspaceId, GovernedAction action);

    Optional<FailureInjectionConfig> findByWorkspaceIdAndAction(UUID workspaceId, GovernedAction action);

    List<FailureInjectionConfig> findByWorkspaceIdOrderByActionAsc(UUID workspaceId);
}
