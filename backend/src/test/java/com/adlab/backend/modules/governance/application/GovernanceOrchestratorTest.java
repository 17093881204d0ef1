package com.adlab.backend.modules.governance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.governance.application.guard.GuardChain;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.governance.domain.PermissionDeniedException;
import com.adlab.backend.modules.snapshot.application.PromotionEngine;
import com.adlab.backend.modules.snapshot.application.PromotionResult;
import com.adlab.backend.modules.snapshot.application.RollbackEngine;
import com.adlab.backend.modules.snapshot.application.RollbackResult;
import com.adlab.backend.modules.snapshot.domain.IngestionLog;
import com.adlab.backend.modules.snapshot.domain.IngestionStatus;
import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;
import com.adlab.backend.modules.workspace.application.ActorResolver;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class GovernanceOrchestratorTest {

    private static final UUID WORKSPACE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID LOG_ID = UUID.fromString("00000000-0000-0000-0000-00000000c001");

    @Mock
    private ActorResolver actorResolver;

    @Mock
    private GuardChain guardChain;

    @Mock
    private GovernedTargetResolver targetResolver;

    @Mock
    private PromotionEngine promotionEngine;

    @Mock
    private RollbackEngine rollbackEngine;

    @Mock
    private AuditLogService auditLogService;

    private GovernanceOrchestrator orchestrator;
    private Actor admin;

    @BeforeEach
    void setUp() {
        orchestrator = new GovernanceOrchestrator(actorResolver, guardChain, targetResolver, promotionEngine,
                rollbackEngine, auditLogService);
        admin = new Actor(UUID.randomUUID(), WorkspaceRole.ADMIN, WORKSPACE_ID);
    }

    @Test
    @DisplayName("successful promotion is audited with the snapshot id and its predecessor")
    void promotionIsAudited() {
        ProductionSnapshot created = snapshot(true);
        UUID previousId = UUID.randomUUID();
        when(actorResolver.resolveCurrentActor()).thenReturn(admin);
        when(promotionEngine.promote(LOG_ID, admin)).thenReturn(new PromotionResult(created, previousId));

        PromotionResult result = orchestrator.promote(LOG_ID);

        assertThat(result.snapshot()).isSameAs(created);
        ArgumentCaptor<AuditEntryCommand> captor = ArgumentCaptor.forClass(AuditEntryCommand.class);
        verify(auditLogService).append(captor.capture());
        AuditEntryCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(AuditAction.PROMOTE);
        assertThat(command.entityId()).isEqualTo(created.getId().toString());
        assertThat(command.scope().platform()).isEqualTo("meta");
        assertThat(command.metadata())
                .containsEntry("ingestionLogId", LOG_ID.toString())
                .containsEntry("previousSnapshotId", previousId.toString());
    }

    @Test
    void rejectedGuardStopsBeforeMutation() {
        doThrow(new PermissionDeniedException(GovernedAction.PROMOTE, WorkspaceRole.VIEWER))
                .when(guardChain).enforce(any());

        assertThatThrownBy(() -> orchestrator.promote(admin, LOG_ID))
                .isInstanceOf(PermissionDeniedException.class);

        verifyNoInteractions(promotionEngine, auditLogService);
    }

    @Test
    @DisplayName("audit failure after a committed promotion is reported, not swallowed")
    void auditFailureAfterCommitIsReported() {
        ProductionSnapshot created = snapshot(true);
        when(promotionEngine.promote(LOG_ID, admin)).thenReturn(new PromotionResult(created, null));
        when(auditLogService.append(any())).thenThrow(new AuditWriteException("db down"));

        assertThatThrownBy(() -> orchestrator.promote(admin, LOG_ID))
                .isInstanceOfSatisfying(AuditWriteException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GovernanceErrorKind.AUDIT_WRITE_ERROR);
                    assertThat(ex.getDetailMessage()).contains(created.getId().toString());
                });
    }

    @Test
    void concurrentChangeIsReportedAsConflict() {
        when(promotionEngine.promote(LOG_ID, admin))
                .thenThrow(new PessimisticLockingFailureException("could not obtain lock"));

        assertThatThrownBy(() -> orchestrator.promote(admin, LOG_ID))
                .isInstanceOfSatisfying(GovernanceException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GovernanceErrorKind.CONCURRENT_MUTATION);
                    assertThat(ex.getStatusCode().value()).isEqualTo(409);
                });
        verify(auditLogService, never()).append(any());
    }

    @Test
    void rollbackIsAuditedWithTrimmedReason() {
        Actor owner = new Actor(UUID.randomUUID(), WorkspaceRole.OWNER, WORKSPACE_ID);
        ProductionSnapshot activated = snapshot(true);
        UUID previousId = UUID.randomUUID();
        when(rollbackEngine.rollback(eq(activated.getId()), any(), eq(owner)))
                .thenReturn(new RollbackResult(activated, previousId));

        orchestrator.rollback(owner, activated.getId(), "  spend spike ");

        ArgumentCaptor<AuditEntryCommand> captor = ArgumentCaptor.forClass(AuditEntryCommand.class);
        verify(auditLogService).append(captor.capture());
        AuditEntryCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(AuditAction.ROLLBACK);
        assertThat(command.reason()).isEqualTo("spend spike");
        assertThat(command.metadata())
                .containsEntry("previousSnapshotId", previousId.toString())
                .containsEntry("newActiveSnapshotId", activated.getId().toString())
                .containsEntry("ingestionLogId", LOG_ID.toString());
    }

    private static ProductionSnapshot snapshot(boolean active) {
        IngestionLog source = new IngestionLog();
        ReflectionTestUtils.setField(source, "id", LOG_ID);
        source.setWorkspaceId(WORKSPACE_ID);
        source.setPlatform("meta");
        source.setDataset("campaigns");
        source.setStatus(IngestionStatus.PASS);
        source.setValidRows(12);
        ProductionSnapshot snapshot = ProductionSnapshot.promoted(source, UUID.randomUUID(),
                OffsetDateTime.parse("2025-03-01T09:00:00Z"));
        ReflectionTestUtils.setField(snapshot, "id", UUID.randomUUID());
        if (!active) {
            snapshot.supersede();
        }
        return snapshot;
    }
}
