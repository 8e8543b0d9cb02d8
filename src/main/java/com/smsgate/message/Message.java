package com.smsgate.message;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "messages",
        uniqueConstraints = @UniqueConstraint(name = "uk_messages_tenant_external",
                columnNames = {"tenant_id", "external_id"}))
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 128)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private MessageType channel = MessageType.SMS;

    @Column(nullable = false, length = 4096)
    private String content;

    @Column(name = "from_address", nullable = false, length = 32)
    private String fromAddress;

    @Column(name = "to_address", nullable = false, length = 32)
    private String toAddress;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private MessageCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageStatus status = MessageStatus.QUEUED;

    @Column(name = "external_id", length = 64)
    private String externalId;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "contact_id", length = 64)
    private String contactId;

    @Column(name = "error_code", length = 32)
    private String errorCode;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Version
    private long revision;

    public Message() {}

    public Message(String tenantId, MessageDirection direction, MessageType channel,
                   String fromAddress, String toAddress, String content) {
        this.tenantId = tenantId;
        this.direction = direction;
        this.channel = channel;
        this.fromAddress = fromAddress;
        this.toAddress = toAddress;
        this.content = content;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public String getTenantId() { return tenantId; }
    public MessageDirection getDirection() { return direction; }
    public MessageType getChannel() { return channel; }
    public String getContent() { return content; }
    public String getFromAddress() { return fromAddress; }
    public String getToAddress() { return toAddress; }
    public MessageCategory getCategory() { return category; }
    public void setCategory(MessageCategory category) { this.category = category; }
    public MessageStatus getStatus() { return status; }
    public void setStatus(MessageStatus status) { this.status = status; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public String getContactId() { return contactId; }
    public void setContactId(String contactId) { this.contactId = contactId; }
    public String getErrorCode() { return errorCode; }
    public String getErrorMessage() { return errorMessage; }
    public void setError(String errorCode, String errorMessage) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getDeliveredAt() { return deliveredAt; }
    public void setDeliveredAt(Instant deliveredAt) { this.deliveredAt = deliveredAt; }
    public long getRevision() { return revision; }
}
