package com.coachvault.vaultbackend.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Best-effort audit trail. A failed write is logged and dropped so it can
 * never fail the action being recorded.
 */
@Service
@Slf4j
public class AuditService {

    private final AuditEventRepository repository;
    private final TransactionTemplate auditTx;

    public AuditService(AuditEventRepository repository, PlatformTransactionManager txManager) {
        this.repository = repository;
        this.auditTx = new TransactionTemplate(txManager);
        // Own transaction, so a failed insert never marks the caller's transaction rollback-only
        this.auditTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(String actorId, String action, String subjectType, String subjectId) {
        record(actorId, action, subjectType, subjectId, null);
    }

    public void record(String actorId,
                       String action,
                       String subjectType,
                       String subjectId,
                       Map<String, Object> metadata) {
        AuditEvent event = new AuditEvent();
        event.setActorId(actorId);
        event.setAction(action);
        event.setSubjectType(subjectType);
        event.setSubjectId(subjectId);
        event.setMetadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>());

        try {
            auditTx.executeWithoutResult(status -> repository.save(event));
            log.debug("[AUDIT] {} by {} on {}:{}", action, actorId, subjectType, subjectId);
        } catch (RuntimeException e) {
            log.error("[AUDIT] Failed to record {} by {} on {}:{}", action, actorId, subjectType, subjectId, e);
        }
    }
}
