package com.smsgate.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only audit trail for sends, gate denials, consent changes and webhook authentication.
 * Audit writes run in their own transaction so a failed business operation still leaves a record.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository auditRepository;

    public AuditService(AuditRepository auditRepository) {
        this.auditRepository = auditRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditEvent log(AuditEvent event) {
        AuditEvent saved = auditRepository.save(event);
        log.info("audit event={} action={} tenant={} resource={}:{} outcome={}",
                saved.getEventType(), saved.getAction(), saved.getTenantId(),
                saved.getResourceType(), saved.getResourceId(), saved.getOutcome());
        return saved;
    }

    public void logWebhookAuth(String tenantId, String path, boolean success, String sourceIp) {
        log(AuditEvent.of(success ? AuditEvent.TYPE_WEBHOOK_AUTH_SUCCESS : AuditEvent.TYPE_WEBHOOK_AUTH_FAILURE,
                        "WEBHOOK_AUTH " + path)
                .withTenantId(tenantId)
                .withSourceIp(sourceIp)
                .withOutcome(success ? "SUCCESS" : "AUTH_FAILED"));
    }

    public void logMessageEvent(String eventType, String tenantId, String messageId,
                                String action, String outcome) {
        log(AuditEvent.of(eventType, action)
                .withTenantId(tenantId)
                .withResource("message", messageId)
                .withOutcome(outcome));
    }

    public void logDenial(String eventType, String tenantId, String reason) {
        log(AuditEvent.of(eventType, "SEND_DENIED")
                .withTenantId(tenantId)
                .withDetails(reason)
                .withOutcome("DENIED"));
    }

    public void logConsentChange(String tenantId, String consentId, String from, String to, String source) {
        log(AuditEvent.of(AuditEvent.TYPE_CONSENT_CHANGED, from + " -> " + to)
                .withTenantId(tenantId)
                .withResource("consent", consentId)
                .withDetails("source=" + source));
    }

    public Page<AuditEvent> findByTenant(String tenantId, Pageable pageable) {
        return auditRepository.findByTenantIdOrderByOccurredAtDesc(tenantId, pageable);
    }
}
