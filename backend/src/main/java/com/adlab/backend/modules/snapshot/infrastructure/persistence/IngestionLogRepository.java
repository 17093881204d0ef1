package com.adlab.backend.modules.snapshot.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.modules.snapshot.domain.IngestionLog;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IngestionLogRepository extends JpaRepository<IngestionLog, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from IngestionLog l where l.id = :id")
    Optional<IngestionLog> findByIdForUpdate(@Param("id") UUID id);
}
