package com.caf.backend.modules.access.application;

import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.PermissionDecision;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Enforcing wrapper around {@link PolicyEngine}. Denials surface as {@link ForbiddenException};
 * policy anomalies are additionally audited in their own transaction so a rollback of the
 * request does not erase them.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final PolicyEngine policyEngine;
    private final AuditRecorder auditRecorder;
    private final TransactionTemplate anomalyTransaction;

    public AccessGuard(PolicyEngine policyEngine, AuditRecorder auditRecorder, PlatformTransactionManager transactionManager) {
        this.policyEngine = policyEngine;
        this.auditRecorder = auditRecorder;
        this.anomalyTransaction = new TransactionTemplate(transactionManager);
        this.anomalyTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public PermissionDecision require(Actor actor, Resource resource, AccessAction action) {
        PermissionDecision decision = policyEngine.authorize(actor, resource, action);
        if (decision.allowed()) {
            if (action == AccessAction.READ && isSensitive(resource)) {
                log.debug("Sensitive read allowed actor={} role={} {}:{} sensitivity={}",
                        actor.id(), actor.roleCode(), resource.entityType().code(), resource.entityId(), resource.sensitivityCode());
            }
            return decision;
        }

        if (decision.isAnomaly()) {
            log.warn("Policy anomaly actor={} role={} {}:{} sensitivity={} action={} reason={}",
                    actor.id(), actor.roleCode(), resource.entityType().code(), resource.entityId(),
                    resource.sensitivityCode(), action, decision.reason().code());
            try {
                anomalyTransaction.executeWithoutResult(status -> auditRecorder.recordPolicyAnomaly(decision));
            } catch (RuntimeException ex) {
                log.error("Failed to audit policy anomaly for actor={}", actor.id(), ex);
                throw new ForbiddenException(ex);
            }
        } else {
            log.debug("Access denied actor={} role={} {}:{} action={} reason={}",
                    actor.id(), actor.roleCode(), resource.entityType().code(), resource.entityId(),
                    action, decision.reason().code());
        }
        throw new ForbiddenException();
    }

    public boolean check(Actor actor, Resource resource, AccessAction action) {
        return policyEngine.isAllowed(actor, resource, action);
    }

    private static boolean isSensitive(Resource resource) {
        return resource.sensitivity()
                .map(category -> category == SensitivityCategory.LEGAL || category == SensitivityCategory.PSYCHOLOGICAL)
                .orElse(false);
    }
}
