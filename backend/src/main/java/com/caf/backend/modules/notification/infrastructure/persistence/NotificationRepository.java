package com.caf.backend.modules.notification.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.caf.backend.modules.notification.domain.Notification;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Notification> findFirstByUserIdAndDedupKeyAndReadFalse(UUID userId, String dedupKey);

    Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

    List<Notification> findByUserIdAndIdIn(UUID userId, Collection<UUID> ids);

    List<Notification> findByUserIdAndReadFalse(UUID userId);

    long countByUserIdAndReadFalse(UUID userId);

    @Query("""
            select n
              from Notification n
             where n.userId = :userId
             order by n.triggeredAt desc, n.id desc
            """)
    Page<Notification> findPageByUserId(@Param("userId") UUID userId, Pageable pageable);
}
