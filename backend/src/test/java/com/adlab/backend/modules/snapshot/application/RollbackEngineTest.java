package com.adlab.backend.modules.snapshot.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.modules.snapshot.domain.IngestionLog;
import com.adlab.backend.modules.snapshot.domain.IngestionStatus;
import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.ProductionSnapshotRepository;
import com.adlab.backend.modules.workspace.domain.Actor;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RollbackEngineTest {

    private static final UUID WORKSPACE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private ProductionSnapshotRepository snapshotRepository;

    private RollbackEngine engine;
    private Actor owner;

    @BeforeEach
    void setUp() {
        engine = new RollbackEngine(snapshotRepository, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        owner = new Actor(UUID.randomUUID(), WorkspaceRole.OWNER, WORKSPACE_ID);
    }

    @Test
    void blankReasonIsRejectedBeforeAnyLookup() {
        assertThatThrownBy(() -> engine.rollback(UUID.randomUUID(), "   ", owner))
                .isInstanceOfSatisfying(GovernanceException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(GovernanceErrorKind.VALIDATION_ERROR));
        verifyNoInteractions(snapshotRepository);
    }

    @Test
    void missingSnapshotIsNotFound() {
        UUID snapshotId = UUID.randomUUID();
        when(snapshotRepository.findByIdForUpdate(snapshotId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> engine.rollback(snapshotId, "bad data", owner))
                .isInstanceOfSatisfying(GovernanceException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(GovernanceErrorKind.NOT_FOUND));
    }

    @Test
    void snapshotOfAnotherWorkspaceIsForbidden() {
        ProductionSnapshot foreign = snapshot(UUID.randomUUID(), false);
        when(snapshotRepository.findByIdForUpdate(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> engine.rollback(foreign.getId(), "bad data", owner))
                .isInstanceOfSatisfying(GovernanceException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(GovernanceErrorKind.FORBIDDEN));
    }

    @Test
    void activeSnapshotCannotBeRolledBackTo() {
        ProductionSnapshot active = snapshot(WORKSPACE_ID, true);
        when(snapshotRepository.findByIdForUpdate(active.getId())).thenReturn(Optional.of(active));

        assertThatThrownBy(() -> engine.rollback(active.getId(), "bad data", owner))
                .isInstanceOfSatisfying(GovernanceException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GovernanceErrorKind.ALREADY_ACTIVE);
                    assertThat(ex.getStatusCode().value()).isEqualTo(409);
                    assertThat(ex.getCode()).isEqualTo("rollback.snapshot_already_active");
                });
        verify(snapshotRepository, never()).flush();
    }

    @Test
    @DisplayName("rollback flips the active flag and stamps the replaced snapshot with the reason")
    void rollbackSwapsActiveSnapshot() {
        ProductionSnapshot target = snapshot(WORKSPACE_ID, false);
        ProductionSnapshot current = snapshot(WORKSPACE_ID, true);
        when(snapshotRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));
        when(snapshotRepository.findActiveForUpdate(WORKSPACE_ID, "google", "ad_groups"))
                .thenReturn(Optional.of(current));

        RollbackResult result = engine.rollback(target.getId(), "  spend spike  ", owner);

        assertThat(result.activated()).isSameAs(target);
        assertThat(result.previousSnapshotId()).isEqualTo(current.getId());
        assertThat(target.isActive()).isTrue();
        assertThat(current.isActive()).isFalse();
        assertThat(current.getRollbackReason()).isEqualTo("spend spike");
        assertThat(current.getRolledBackAt()).isEqualTo(NOW);
    }

    private static ProductionSnapshot snapshot(UUID workspaceId, boolean active) {
        IngestionLog source = new IngestionLog();
        ReflectionTestUtils.setField(source, "id", UUID.randomUUID());
        source.setWorkspaceId(workspaceId);
        source.setPlatform("google");
        source.setDataset("ad_groups");
        source.setStatus(IngestionStatus.PASS);
        source.setValidRows(7);
        ProductionSnapshot snapshot = ProductionSnapshot.promoted(source, UUID.randomUUID(), NOW.minusDays(3));
        ReflectionTestUtils.setField(snapshot, "id", UUID.randomUUID());
        if (!active) {
            snapshot.supersede();
        }
        return snapshot;
    }
}
