package com.smsgate.audit;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_log")
public class AuditEvent {

    public static final String TYPE_WEBHOOK_AUTH_SUCCESS = "WEBHOOK_AUTH_SUCCESS";
    public static final String TYPE_WEBHOOK_AUTH_FAILURE = "WEBHOOK_AUTH_FAILURE";
    public static final String TYPE_MESSAGE_SENT = "MESSAGE_SENT";
    public static final String TYPE_DELIVERY_FAILED = "DELIVERY_FAILED";
    public static final String TYPE_CONSENT_DENIED = "CONSENT_DENIED";
    public static final String TYPE_RATE_LIMITED = "RATE_LIMITED";
    public static final String TYPE_CONSENT_CHANGED = "CONSENT_CHANGED";
    public static final String TYPE_RATE_LIMIT_RESET = "RATE_LIMIT_RESET";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt = Instant.now();

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "tenant_id", length = 128)
    private String tenantId;

    @Column(nullable = false, length = 256)
    private String action;

    @Column(name = "resource_type", length = 64)
    private String resourceType;

    @Column(name = "resource_id", length = 256)
    private String resourceId;

    @Column(length = 2048)
    private String details;

    @Column(name = "source_ip", length = 45)
    private String sourceIp;

    @Column(nullable = false, length = 16)
    private String outcome = "SUCCESS";

    public AuditEvent() {}

    public static AuditEvent of(String eventType, String action) {
        AuditEvent event = new AuditEvent();
        event.eventType = eventType;
        event.action = action;
        return event;
    }

    public AuditEvent withTenantId(String tenantId) { this.tenantId = tenantId; return this; }
    public AuditEvent withResource(String type, String id) { this.resourceType = type; this.resourceId = id; return this; }
    public AuditEvent withDetails(String details) { this.details = details; return this; }
    public AuditEvent withSourceIp(String sourceIp) { this.sourceIp = sourceIp; return this; }
    public AuditEvent withOutcome(String outcome) { this.outcome = outcome; return this; }

    public UUID getId() { return id; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getEventType() { return eventType; }
    public String getTenantId() { return tenantId; }
    public String getAction() { return action; }
    public String getResourceType() { return resourceType; }
    public String getResourceId() { return resourceId; }
    public String getDetails() { return details; }
    public String getSourceIp() { return sourceIp; }
    public String getOutcome() { return outcome; }
}
