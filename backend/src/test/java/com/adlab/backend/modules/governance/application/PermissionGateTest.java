package com.adlab.backend.modules.governance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditScope;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.governance.domain.GovernedTarget;
import com.adlab.backend.modules.governance.domain.PermissionDeniedException;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PermissionGateTest {

    private static final UUID WORKSPACE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID SNAPSHOT_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");

    @Mock
    private AuditLogService auditLogService;

    private PermissionGate permissionGate;
    private GovernedTarget target;

    @BeforeEach
    void setUp() {
        permissionGate = new PermissionGate(auditLogService);
        target = new GovernedTarget(AuditEntityType.SNAPSHOT, SNAPSHOT_ID, WORKSPACE_ID,
                new AuditScope("meta", "campaigns"));
    }

    @ParameterizedTest
    @CsvSource({
            "OWNER, ROLLBACK, true",
            "ADMIN, ROLLBACK, false",
            "ADMIN, PROMOTE, true",
            "EDITOR, PROMOTE, false",
            "EDITOR, VALIDATE, true",
            "VIEWER, INGEST, false",
            "VIEWER, READ, true",
            "ADMIN, MANAGE_SAFETY_CONTROLS, false"
    })
    void canPerformFollowsMinimumRole(WorkspaceRole role, GovernedAction action, boolean expected) {
        assertThat(PermissionGate.canPerform(role, action)).isEqualTo(expected);
    }

    @Test
    void canPerformRejectsMissingRole() {
        assertThat(PermissionGate.canPerform(null, GovernedAction.READ)).isFalse();
    }

    @Test
    @DisplayName("denied governed action is audited with the attempted action and roles")
    void deniedActionIsAudited() {
        Actor admin = actor(WorkspaceRole.ADMIN);

        assertThatThrownBy(() -> permissionGate.requirePermissionAudited(admin, GovernedAction.ROLLBACK, target))
                .isInstanceOf(PermissionDeniedException.class)
                .satisfies(ex -> assertThat(((PermissionDeniedException) ex).getKind())
                        .isEqualTo(GovernanceErrorKind.PERMISSION_DENIED));

        ArgumentCaptor<AuditEntryCommand> captor = ArgumentCaptor.forClass(AuditEntryCommand.class);
        verify(auditLogService).append(captor.capture());
        AuditEntryCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(AuditAction.PERMISSION_DENIED);
        assertThat(command.entityType()).isEqualTo(AuditEntityType.SNAPSHOT);
        assertThat(command.entityId()).isEqualTo(SNAPSHOT_ID.toString());
        assertThat(command.metadata())
                .containsEntry("attemptedAction", "ROLLBACK")
                .containsEntry("requiredRole", "OWNER")
                .containsEntry("actorRole", "ADMIN");
    }

    @Test
    @DisplayName("denial is still returned when its audit entry cannot be written")
    void denialSurvivesAuditFailure() {
        when(auditLogService.append(any())).thenThrow(new AuditWriteException("db down"));

        assertThatThrownBy(() -> permissionGate.requirePermissionAudited(
                actor(WorkspaceRole.VIEWER), GovernedAction.PROMOTE, target))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    void allowedActionWritesNothing() {
        permissionGate.requirePermissionAudited(actor(WorkspaceRole.OWNER), GovernedAction.ROLLBACK, target);
        permissionGate.requirePermission(actor(WorkspaceRole.VIEWER), GovernedAction.READ);

        verify(auditLogService, never()).append(any());
    }

    @Test
    void unauditedCheckDoesNotRecordDenial() {
        assertThatThrownBy(() -> permissionGate.requirePermission(
                actor(WorkspaceRole.ADMIN), GovernedAction.MANAGE_SAFETY_CONTROLS))
                .isInstanceOf(PermissionDeniedException.class);

        verify(auditLogService, never()).append(any());
    }

    private static Actor actor(WorkspaceRole role) {
        return new Actor(UUID.randomUUID(), role, WORKSPACE_ID);
    }
}
