package com.caf.backend.modules.notification.application;

import java.util.List;

import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.notification.domain.NotificationIntent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs classification and delivery once the mutation has committed. Work queued here is lost if
 * the node stops; the audit trail is not.
 */
@Component
public class NotificationPipeline {

    private static final Logger log = LoggerFactory.getLogger(NotificationPipeline.class);

    private final EventClassifier eventClassifier;
    private final NotificationStore notificationStore;

    public NotificationPipeline(EventClassifier eventClassifier, NotificationStore notificationStore) {
        this.eventClassifier = eventClassifier;
        this.notificationStore = notificationStore;
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCaseMutation(CaseMutationEvent event) {
        try {
            List<NotificationIntent> intents = eventClassifier.classify(event);
            if (intents.isEmpty()) {
                log.debug("No recipients for {} on {}:{}", event.kind(), event.entityType().code(), event.entityId());
                return;
            }
            for (NotificationIntent intent : intents) {
                notificationStore.enqueue(intent);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to deliver notifications for {} on {}:{}",
                    event.kind(), event.entityType().code(), event.entityId(), ex);
        }
    }
}
