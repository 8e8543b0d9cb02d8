package com.smsgate.consent;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Consent of one phone number for one consent type within a tenant.
 * {@code version} counts accepted status changes; {@code revision} is the optimistic lock.
 */
@Entity
@Table(name = "consent_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_consent_tenant_phone_type",
                columnNames = {"tenant_id", "phone_number", "consent_type"}))
public class ConsentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 128)
    private String tenantId;

    @Column(name = "phone_number", nullable = false, length = 32)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ConsentStatus status = ConsentStatus.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ConsentSource source = ConsentSource.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(name = "consent_type", nullable = false, length = 32)
    private ConsentType type = ConsentType.MARKETING;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_method", length = 32)
    private VerificationMethod verificationMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "legal_basis", length = 32)
    private LegalBasis legalBasis;

    @Column(name = "opt_in_date")
    private Instant optInDate;

    @Column(name = "opt_out_date")
    private Instant optOutDate;

    @Column(name = "consent_version", nullable = false)
    private int version = 0;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consent_audit_entries", joinColumns = @JoinColumn(name = "consent_id"))
    @OrderColumn(name = "entry_index")
    private List<ConsentAuditEntry> auditTrail = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consent_metadata", joinColumns = @JoinColumn(name = "consent_id"))
    @MapKeyColumn(name = "meta_key", length = 64)
    @Column(name = "meta_value", length = 1024)
    private Map<String, String> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Version
    private long revision;

    public ConsentRecord() {}

    public ConsentRecord(String tenantId, String phoneNumber, ConsentType type) {
        this.tenantId = tenantId;
        this.phoneNumber = phoneNumber;
        this.type = type;
    }

    public UUID getId() { return id; }
    public String getTenantId() { return tenantId; }
    public String getPhoneNumber() { return phoneNumber; }
    public ConsentStatus getStatus() { return status; }
    public void setStatus(ConsentStatus status) { this.status = status; }
    public ConsentSource getSource() { return source; }
    public void setSource(ConsentSource source) { this.source = source; }
    public ConsentType getType() { return type; }
    public VerificationMethod getVerificationMethod() { return verificationMethod; }
    public void setVerificationMethod(VerificationMethod verificationMethod) { this.verificationMethod = verificationMethod; }
    public LegalBasis getLegalBasis() { return legalBasis; }
    public void setLegalBasis(LegalBasis legalBasis) { this.legalBasis = legalBasis; }
    public Instant getOptInDate() { return optInDate; }
    public void setOptInDate(Instant optInDate) { this.optInDate = optInDate; }
    public Instant getOptOutDate() { return optOutDate; }
    public void setOptOutDate(Instant optOutDate) { this.optOutDate = optOutDate; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public List<ConsentAuditEntry> getAuditTrail() { return auditTrail; }
    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public long getRevision() { return revision; }
}
