package com.adlab.backend.modules.snapshot.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProductionSnapshotRepository extends JpaRepository<ProductionSnapshot, UUID> {

    @Query("""
            select s from ProductionSnapshot s
             where s.workspaceId = :workspaceId
               and s.platform = :platform
               and s.dataset = :dataset
               and s.active = true
            """)
    Optional<ProductionSnapshot> findActive(
            @Param("workspaceId") UUID workspaceId,
            @Param("platform") String platform,
            @Param("dataset") String dataset
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s from ProductionSnapshot s
             where s.workspaceId = :workspaceId
               and s.platform = :platform
               and s.dataset = :dataset
               and s.active = true
            """)
    Optional<ProductionSnapshot> findActiveForUpdate(
            @Param("workspaceId") UUID workspaceId,
            @Param("platform") String platform,
            @Param("dataset") String dataset
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ProductionSnapshot s where s.id = :id")
    Optional<ProductionSnapshot> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select s from ProductionSnapshot s
             where s.workspaceId = :workspaceId
               and s.platform = :platform
               and s.dataset = :dataset
             order by s.createdAt desc
            """)
    List<ProductionSnapshot> findHistory(
            @Param("workspaceId") UUID workspaceId,
            @Param("platform") String platform,
            @Param("dataset") String dataset,
            Pageable pageable
    );

    @Query("""
            select count(s) from ProductionSnapshot s
             where s.workspaceId = :workspaceId
               and s.platform = :platform
               and s.dataset = :dataset
               and s.active = true
            """)
    long countActive(
            @Param("workspaceId") UUID workspaceId,
            @Param("platform") String platform,
            @Param("dataset") String dataset
    );
}
