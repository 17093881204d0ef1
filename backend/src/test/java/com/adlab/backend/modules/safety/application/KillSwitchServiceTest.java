package com.adlab.backend.modules.safety.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.global.config.GovernanceProperties;
import com.adlab.backend.global.error.ProblemException;
import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.governance.application.PermissionGate;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.governance.domain.PermissionDeniedException;
import com.adlab.backend.modules.safety.domain.KillSwitch;
import com.adlab.backend.modules.safety.domain.KillSwitchScope;
import com.adlab.backend.modules.safety.infrastructure.persistence.KillSwitchRepository;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class KillSwitchServiceTest {

    private static final UUID WORKSPACE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private KillSwitchRepository killSwitchRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private Actor owner;
    private Actor admin;

    @BeforeEach
    void setUp() {
        owner = new Actor(UUID.randomUUID(), WorkspaceRole.OWNER, WORKSPACE_ID);
        admin = new Actor(UUID.randomUUID(), WorkspaceRole.ADMIN, WORKSPACE_ID);
    }

    @Test
    void readsAreNeverBlocked() {
        service(true).assertKillSwitchOpen(owner, GovernedAction.READ);
        service(true).assertKillSwitchOpen(owner, GovernedAction.MANAGE_SAFETY_CONTROLS);

        verifyNoInteractions(killSwitchRepository, auditLogService);
    }

    @Test
    @DisplayName("global switch wins over an enabled workspace switch and the block is audited")
    void globalSwitchBlocksAndIsAudited() {
        when(killSwitchRepository.findApplicable(WORKSPACE_ID)).thenReturn(List.of(
                enabledWorkspaceSwitch("workspace maintenance"),
                enabledGlobalSwitch("provider outage")
        ));

        assertThatThrownBy(() -> service(true).assertKillSwitchOpen(owner, GovernedAction.ROLLBACK))
                .isInstanceOfSatisfying(KillSwitchActiveException.class, ex -> {
                    assertThat(ex.getScope()).isEqualTo(KillSwitchScope.GLOBAL);
                    assertThat(ex.getReason()).isEqualTo("provider outage");
                    assertThat(ex.getStatusCode().value()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE.value());
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(60);
                });

        ArgumentCaptor<AuditEntryCommand> captor = ArgumentCaptor.forClass(AuditEntryCommand.class);
        verify(auditLogService).append(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.KILL_SWITCH_BLOCKED);
        assertThat(captor.getValue().metadata()).containsEntry("attemptedAction", "ROLLBACK");
    }

    @Test
    void workspaceSwitchBlocksOnlyItsWorkspace() {
        when(killSwitchRepository.findApplicable(WORKSPACE_ID)).thenReturn(List.of(
                disabledGlobalSwitch(),
                enabledWorkspaceSwitch("bad import")
        ));

        assertThatThrownBy(() -> service(false).assertKillSwitchOpen(owner, GovernedAction.PROMOTE))
                .isInstanceOfSatisfying(KillSwitchActiveException.class,
                        ex -> assertThat(ex.getScope()).isEqualTo(KillSwitchScope.WORKSPACE));
        verify(auditLogService, never()).append(any());
    }

    @Test
    void blockIsReturnedWhenItsAuditFails() {
        when(killSwitchRepository.findApplicable(WORKSPACE_ID)).thenReturn(List.of(enabledGlobalSwitch("outage")));
        when(auditLogService.append(any())).thenThrow(new AuditWriteException("db down"));

        assertThatThrownBy(() -> service(true).assertKillSwitchOpen(owner, GovernedAction.PROMOTE))
                .isInstanceOf(KillSwitchActiveException.class);
    }

    @Test
    void openSwitchesLetMutationsThrough() {
        when(killSwitchRepository.findApplicable(WORKSPACE_ID)).thenReturn(List.of(disabledGlobalSwitch()));

        service(true).assertKillSwitchOpen(owner, GovernedAction.PROMOTE);

        verifyNoInteractions(auditLogService);
    }

    @Test
    void onlyOwnersToggleSwitches() {
        assertThatThrownBy(() -> service(true).setWorkspace(admin, true, "outage"))
                .isInstanceOf(PermissionDeniedException.class);

        verifyNoInteractions(killSwitchRepository);
    }

    @Test
    void enablingRequiresReason() {
        assertThatThrownBy(() -> service(true).setWorkspace(owner, true, "  "))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("safety.reason_required"));
    }

    @Test
    @DisplayName("first workspace toggle creates the row and audits the change")
    void workspaceToggleCreatesRow() {
        when(killSwitchRepository.findWorkspaceForUpdate(WORKSPACE_ID)).thenReturn(Optional.empty());
        when(killSwitchRepository.save(any(KillSwitch.class))).thenAnswer(invocation -> {
            KillSwitch saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });

        KillSwitch updated = service(true).setWorkspace(owner, true, " bad import ");

        assertThat(updated.getScope()).isEqualTo(KillSwitchScope.WORKSPACE);
        assertThat(updated.isEnabled()).isTrue();
        assertThat(updated.getReason()).isEqualTo("bad import");
        assertThat(updated.getActivatedBy()).isEqualTo(owner.id());
        assertThat(updated.getActivatedAt()).isEqualTo(NOW);

        ArgumentCaptor<AuditEntryCommand> captor = ArgumentCaptor.forClass(AuditEntryCommand.class);
        verify(auditLogService).append(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.KILL_SWITCH_ENABLED);
        assertThat(captor.getValue().entityType()).isEqualTo(AuditEntityType.KILL_SWITCH);
        assertThat(captor.getValue().entityId()).isEqualTo(updated.getId().toString());
    }

    @Test
    void disablingWorkspaceSwitchNeedsNoReason() {
        KillSwitch workspace = enabledWorkspaceSwitch("outage");
        when(killSwitchRepository.findWorkspaceForUpdate(WORKSPACE_ID)).thenReturn(Optional.of(workspace));
        when(killSwitchRepository.save(workspace)).thenReturn(workspace);

        KillSwitch updated = service(true).setWorkspace(owner, false, null);

        assertThat(updated.isEnabled()).isFalse();
        assertThat(updated.getDeactivatedBy()).isEqualTo(owner.id());
        ArgumentCaptor<AuditEntryCommand> captor = ArgumentCaptor.forClass(AuditEntryCommand.class);
        verify(auditLogService).append(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.KILL_SWITCH_DISABLED);
    }

    private KillSwitchService service(boolean auditBlockedRequests) {
        GovernanceProperties properties = new GovernanceProperties(
                new GovernanceProperties.Safety(60, auditBlockedRequests),
                new GovernanceProperties.Audit(50, 200)
        );
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        return new KillSwitchService(killSwitchRepository, auditLogService, new PermissionGate(auditLogService),
                properties, transactionManager, clock);
    }

    private static KillSwitch enabledGlobalSwitch(String reason) {
        KillSwitch global = disabledGlobalSwitch();
        global.enable(reason, UUID.randomUUID(), NOW.minusHours(1));
        return global;
    }

    private static KillSwitch disabledGlobalSwitch() {
        KillSwitch global = KillSwitch.forWorkspace(UUID.randomUUID());
        ReflectionTestUtils.setField(global, "scope", KillSwitchScope.GLOBAL);
        ReflectionTestUtils.setField(global, "workspaceId", null);
        ReflectionTestUtils.setField(global, "id", UUID.randomUUID());
        return global;
    }

    private static KillSwitch enabledWorkspaceSwitch(String reason) {
        KillSwitch workspace = KillSwitch.forWorkspace(WORKSPACE_ID);
        ReflectionTestUtils.setField(workspace, "id", UUID.randomUUID());
        workspace.enable(reason, UUID.randomUUID(), NOW.minusHours(1));
        return workspace;
    }
}
