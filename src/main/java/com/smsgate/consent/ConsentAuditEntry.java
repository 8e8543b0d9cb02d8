package com.smsgate.consent;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.Instant;

@Embeddable
public class ConsentAuditEntry {

    @Column(nullable = false, length = 64)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ConsentSource source;

    @Column(length = 512)
    private String context;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    public ConsentAuditEntry() {}

    public ConsentAuditEntry(String action, ConsentSource source, String context, Instant recordedAt) {
        this.action = action;
        this.source = source;
        this.context = context;
        this.recordedAt = recordedAt;
    }

    public String getAction() { return action; }
    public ConsentSource getSource() { return source; }
    public String getContext() { return context; }
    public Instant getRecordedAt() { return recordedAt; }
}
