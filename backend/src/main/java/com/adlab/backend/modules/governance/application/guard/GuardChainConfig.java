package com.adlab.backend.modules.governance.application.guard;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Guard order of every governed request. The kill switch must stay ahead of permission.
 */
@Configuration
public class GuardChainConfig {

    @Bean
    public GuardChain governanceGuardChain(
            KillSwitchGuard killSwitchGuard,
            FailureInjectionGuard failureInjectionGuard,
            TargetScopeGuard targetScopeGuard,
            PermissionGuard permissionGuard
    ) {
        return new GuardChain(List.of(
                killSwitchGuard,
                failureInjectionGuard,
                targetScopeGuard,
                permissionGuard
        ));
    }
}
