package com.caf.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Deletes audit entries past their {@code expires_at}. Entries without an expiry are kept.
 */
@Component
@ConditionalOnProperty(name = "caf.audit.retention.purge-enabled", havingValue = "true")
public class AuditRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(AuditRetentionJob.class);

    private final AuditEntryRepository auditEntryRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int batchSize;

    public AuditRetentionJob(
            AuditEntryRepository auditEntryRepository,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${caf.audit.retention.batch-size:500}") int batchSize
    ) {
        this.auditEntryRepository = auditEntryRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Scheduled(cron = "${caf.audit.retention.cron:0 30 3 * * *}", zone = "UTC")
    public void purgeExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int total = 0;
        int deleted;
        do {
            Integer batch = transactionTemplate.execute(status -> auditEntryRepository.deleteExpiredBatch(now, batchSize));
            deleted = batch != null ? batch : 0;
            total += deleted;
        } while (deleted >= batchSize);

        if (total > 0) {
            log.info("Purged {} expired audit entries", total);
        }
    }
}
