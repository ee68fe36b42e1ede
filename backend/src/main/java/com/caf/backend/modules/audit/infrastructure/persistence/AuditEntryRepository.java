package com.caf.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.audit.domain.AuditEntry;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, UUID> {

    Page<AuditEntry> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(EntityType entityType, UUID entityId, Pageable pageable);

    Page<AuditEntry> findByActorIdAndCreatedAtBetweenOrderByCreatedAtDesc(
            UUID actorId,
            OffsetDateTime from,
            OffsetDateTime to,
            Pageable pageable
    );

    Optional<AuditEntry> findFirstByEntityTypeAndEntityIdOrderByCreatedAtDesc(EntityType entityType, UUID entityId);

    @Modifying
    @Query(value = """
            delete from audit_entry
             where id in (
                   select id
                     from audit_entry
                    where expires_at is not null
                      and expires_at < :now
                    limit :batchSize
             )
            """, nativeQuery = true)
    int deleteExpiredBatch(@Param("now") OffsetDateTime now, @Param("batchSize") int batchSize);
}
