package com.caf.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.caf.backend.modules.notification.domain.Notification;
import com.caf.backend.modules.notification.domain.NotificationIntent;
import com.caf.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.caf.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.caf.backend.modules.realtime.application.RealtimeDispatcher;
import com.caf.backend.modules.realtime.application.RealtimeEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

/**
 * Durable per-recipient notifications. For a given user and dedup key at most one unread row
 * exists: a repeated trigger refreshes it, and once read a new row is started instead.
 */
@Service
public class NotificationStore {

    private static final Logger log = LoggerFactory.getLogger(NotificationStore.class);

    private final NotificationRepository notificationRepository;
    private final RealtimeDispatcher realtimeDispatcher;
    private final TransactionTemplate enqueueTransaction;
    private final KeyedLocks keyedLocks;
    private final Clock clock;

    public NotificationStore(
            NotificationRepository notificationRepository,
            RealtimeDispatcher realtimeDispatcher,
            PlatformTransactionManager transactionManager,
            @Value("${caf.notification.lock-stripes:64}") int lockStripes,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.realtimeDispatcher = realtimeDispatcher;
        this.enqueueTransaction = new TransactionTemplate(transactionManager);
        this.enqueueTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.keyedLocks = new KeyedLocks(lockStripes);
        this.clock = clock;
    }

    /**
     * Stores the intent for every recipient and pushes the stored rows. A recipient whose write
     * fails is logged and skipped; the others are still stored and pushed.
     */
    public List<Notification> enqueue(NotificationIntent intent) {
        List<Notification> stored = new ArrayList<>();
        for (UUID userId : intent.recipientUserIds()) {
            try {
                stored.add(enqueueFor(userId, intent));
            } catch (DataAccessException | TransactionException ex) {
                log.error("Failed to store {} notification for user={} key={}",
                        intent.type().code(), userId, intent.dedupKey(), ex);
            }
        }
        for (Notification notification : stored) {
            realtimeDispatcher.push(notification.getUserId(), RealtimeEvent.notification(NotificationItemResponse.from(notification)));
        }
        return stored;
    }

    @Transactional(readOnly = true)
    public NotificationPageResult list(UUID userId, int page, int size) {
        Page<Notification> result = notificationRepository.findPageByUserId(userId, PageRequest.of(page, size));
        long unreadCount = notificationRepository.countByUserIdAndReadFalse(userId);
        return new NotificationPageResult(
                result.getContent(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                unreadCount
        );
    }

    @Transactional(readOnly = true)
    public long unreadCount(UUID userId) {
        return notificationRepository.countByUserIdAndReadFalse(userId);
    }

    /**
     * Marks the given notifications of this user read. Ids of other users or already read rows are
     * ignored, so repeating the call changes nothing.
     */
    @Transactional
    public int markRead(UUID userId, Collection<UUID> notificationIds) {
        if (notificationIds == null || notificationIds.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = 0;
        for (Notification notification : notificationRepository.findByUserIdAndIdIn(userId, notificationIds)) {
            if (notification.markRead(now)) {
                updated++;
            }
        }
        return updated;
    }

    @Transactional
    public void markRead(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "NOTIFICATION_NOT_FOUND"));
        notification.markRead(OffsetDateTime.now(clock));
    }

    @Transactional
    public int markAllRead(UUID userId) {
        List<Notification> unread = notificationRepository.findByUserIdAndReadFalse(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        return unread.size();
    }

    private Notification enqueueFor(UUID userId, NotificationIntent intent) {
        if (intent.dedupKey() == null) {
            return enqueueTransaction.execute(status ->
                    notificationRepository.save(new Notification(userId, intent, OffsetDateTime.now(clock))));
        }
        return keyedLocks.withLock(userId + "|" + intent.dedupKey(), () -> {
            try {
                return enqueueTransaction.execute(status -> upsert(userId, intent));
            } catch (DataIntegrityViolationException ex) {
                // another node inserted the unread row first
                log.debug("Unread notification for user={} key={} already exists, retrying as update", userId, intent.dedupKey());
                return enqueueTransaction.execute(status -> upsert(userId, intent));
            }
        });
    }

    private Notification upsert(UUID userId, NotificationIntent intent) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return notificationRepository.findFirstByUserIdAndDedupKeyAndReadFalse(userId, intent.dedupKey())
                .map(existing -> {
                    existing.refresh(intent, now);
                    return existing;
                })
                .orElseGet(() -> notificationRepository.saveAndFlush(new Notification(userId, intent, now)));
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }
}
