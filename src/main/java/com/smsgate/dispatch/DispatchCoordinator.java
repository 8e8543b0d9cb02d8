package com.smsgate.dispatch;

import com.smsgate.audit.AuditEvent;
import com.smsgate.audit.AuditService;
import com.smsgate.config.SmsGateProperties;
import com.smsgate.consent.ConsentEngine;
import com.smsgate.consent.ConsentRecord;
import com.smsgate.consent.ConsentRepository;
import com.smsgate.consent.ConsentStatus;
import com.smsgate.consent.ConsentType;
import com.smsgate.contact.Contact;
import com.smsgate.contact.ContactDirectory;
import com.smsgate.gateway.GatewayException;
import com.smsgate.gateway.GatewayReceipt;
import com.smsgate.gateway.JobOptions;
import com.smsgate.gateway.RetryJobQueue;
import com.smsgate.gateway.SmsGateway;
import com.smsgate.message.InvalidTransitionException;
import com.smsgate.message.Message;
import com.smsgate.message.MessageCategory;
import com.smsgate.message.MessageDirection;
import com.smsgate.message.MessageLifecycle;
import com.smsgate.message.MessageNotFoundException;
import com.smsgate.message.MessageRepository;
import com.smsgate.message.MessageStatus;
import com.smsgate.message.MessageType;
import com.smsgate.observability.SmsGateMetrics;
import com.smsgate.phone.PhoneNumbers;
import com.smsgate.ratelimit.RateLimitResult;
import com.smsgate.ratelimit.SmsRateLimiter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Runs outbound sends through validation, consent, rate limiting and the carrier gateway,
 * and records inbound messages exactly once per carrier message id.
 * <p>
 * Every status change goes through {@link MessageLifecycle} and is saved on its own;
 * no database transaction spans the gateway call.
 */
@Service
public class DispatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DispatchCoordinator.class);

    public static final String RETRY_JOB = "retry-sms";

    private final MessageRepository messageRepository;
    private final ConsentRepository consentRepository;
    private final ConsentEngine consentEngine;
    private final SmsRateLimiter rateLimiter;
    private final MessageLifecycle lifecycle;
    private final SmsGateway smsGateway;
    private final RetryJobQueue retryJobQueue;
    private final ContactDirectory contactDirectory;
    private final PhoneNumbers phoneNumbers;
    private final AuditService auditService;
    private final SmsGateMetrics metrics;
    private final SmsGateProperties.DispatchProperties dispatchProperties;
    private final Clock clock;

    public DispatchCoordinator(MessageRepository messageRepository,
                               ConsentRepository consentRepository,
                               ConsentEngine consentEngine,
                               SmsRateLimiter rateLimiter,
                               MessageLifecycle lifecycle,
                               SmsGateway smsGateway,
                               RetryJobQueue retryJobQueue,
                               ContactDirectory contactDirectory,
                               PhoneNumbers phoneNumbers,
                               AuditService auditService,
                               SmsGateMetrics metrics,
                               SmsGateProperties properties,
                               Clock clock) {
        this.messageRepository = messageRepository;
        this.consentRepository = consentRepository;
        this.consentEngine = consentEngine;
        this.rateLimiter = rateLimiter;
        this.lifecycle = lifecycle;
        this.smsGateway = smsGateway;
        this.retryJobQueue = retryJobQueue;
        this.contactDirectory = contactDirectory;
        this.phoneNumbers = phoneNumbers;
        this.auditService = auditService;
        this.metrics = metrics;
        this.dispatchProperties = properties.getDispatch();
        this.clock = clock;
    }

    @Observed(name = "smsgate.dispatch.outbound", contextualName = "dispatch-send-outbound")
    public SendResult sendOutbound(OutboundSendRequest request) {
        validate(request);

        enforceConsent(request.tenantId(), request.to(), request.category());
        RateLimitResult rate = enforceRateLimit(request.tenantId(), request.messageType());

        Instant now = clock.instant();
        Message message = new Message(request.tenantId(), MessageDirection.OUTBOUND, request.messageType(),
                request.from(), request.to(), request.content());
        message.setCategory(request.category());
        message.setContactId(request.contactId());
        message.setCreatedAt(now);
        message.setUpdatedAt(now);
        message = messageRepository.save(message);
        log.info("Outbound message queued id={} tenant={} to={}", message.getId(), message.getTenantId(),
                message.getToAddress());

        return deliver(message, rate.degraded());
    }

    /**
     * Re-attempts a FAILED or UNDELIVERED message. Invoked by {@link RetryJobConsumer} for
     * {@value #RETRY_JOB} jobs and by the retry endpoint.
     * A consent denial cancels the message. A rate-limit denial leaves it in its failed status
     * so a later retry can pick it up after the window resets.
     */
    @Observed(name = "smsgate.dispatch.retry", contextualName = "dispatch-retry")
    public SendResult retry(String tenantId, UUID messageId) {
        Message message = messageRepository.findByIdAndTenantId(messageId, tenantId)
                .orElseThrow(() -> new MessageNotFoundException(tenantId, String.valueOf(messageId)));
        if (!lifecycle.isRetryableFailure(message.getStatus())) {
            throw new InvalidTransitionException(message.getStatus(), MessageStatus.QUEUED);
        }

        try {
            enforceConsent(tenantId, message.getToAddress(), message.getCategory());
        } catch (ConsentDeniedException e) {
            lifecycle.applyTransition(message, MessageStatus.QUEUED);
            lifecycle.applyTransition(message, MessageStatus.CANCELED);
            messageRepository.save(message);
            throw e;
        }
        RateLimitResult rate = enforceRateLimit(tenantId, message.getChannel());

        lifecycle.applyTransition(message, MessageStatus.QUEUED);
        message = messageRepository.save(message);
        log.info("Retrying message id={} attempt={}", message.getId(), message.getRetryCount());
        return deliver(message, rate.degraded());
    }

    @Observed(name = "smsgate.dispatch.inbound", contextualName = "dispatch-receive-inbound")
    public InboundResult receiveInbound(InboundSmsPayload payload) {
        requireText("externalId", payload.externalId());
        requireText("from", payload.from());
        requireText("to", payload.to());
        requireText("body", payload.body());
        requireText("tenantId", payload.tenantId());
        requireMaxLength("from", payload.from(), 32);
        requireMaxLength("to", payload.to(), 32);

        Optional<Message> existing = messageRepository.findByTenantIdAndExternalId(
                payload.tenantId(), payload.externalId());
        if (existing.isPresent()) {
            log.info("Duplicate inbound webhook ignored tenant={} externalId={}",
                    payload.tenantId(), payload.externalId());
            metrics.recordDuplicateWebhook();
            return new InboundResult(existing.get().getId(), true, existing.get().getContactId() != null);
        }

        String sender = phoneNumbers.normalize(payload.from()).orElse(null);
        String contactId = sender != null ? lookupContact(sender) : null;

        Instant now = clock.instant();
        Message message = new Message(payload.tenantId(), MessageDirection.INBOUND, MessageType.SMS,
                sender != null ? sender : payload.from(), payload.to(), payload.body());
        message.setExternalId(payload.externalId());
        message.setStatus(MessageStatus.DELIVERED);
        message.setDeliveredAt(now);
        message.setCreatedAt(now);
        message.setUpdatedAt(now);
        message.setContactId(contactId);

        Message saved;
        try {
            saved = messageRepository.saveAndFlush(message);
        } catch (DataIntegrityViolationException e) {
            // a concurrent delivery of the same webhook won the insert
            Message winner = messageRepository.findByTenantIdAndExternalId(payload.tenantId(), payload.externalId())
                    .orElseThrow(() -> e);
            log.info("Concurrent duplicate inbound webhook resolved tenant={} externalId={}",
                    payload.tenantId(), payload.externalId());
            metrics.recordDuplicateWebhook();
            return new InboundResult(winner.getId(), true, winner.getContactId() != null);
        }

        metrics.recordMessageReceived();
        log.info("Inbound message stored id={} tenant={} contactMatched={}",
                saved.getId(), saved.getTenantId(), contactId != null);
        return new InboundResult(saved.getId(), false, contactId != null);
    }

    private void validate(OutboundSendRequest request) {
        requireText("tenantId", request.tenantId());
        requireText("to", request.to());
        requireText("from", request.from());
        requireText("content", request.content());
        if (request.messageType() == null) {
            throw new ValidationException("messageType", "is required");
        }
        if (request.category() == null) {
            throw new ValidationException("category", "is required");
        }
        if (!phoneNumbers.isE164(request.to())) {
            throw new ValidationException("to", "must be a valid E.164 phone number");
        }
        if (!phoneNumbers.isE164(request.from())) {
            throw new ValidationException("from", "must be a valid E.164 phone number");
        }
        if (request.messageType() == MessageType.SMS
                && request.content().length() > dispatchProperties.getSmsMaxLength()) {
            throw new ValidationException("content",
                    "exceeds " + dispatchProperties.getSmsMaxLength() + " characters");
        }
    }

    private void enforceConsent(String tenantId, String to, MessageCategory category) {
        boolean gated = category == MessageCategory.MARKETING
                || (category == MessageCategory.TRANSACTIONAL
                    && dispatchProperties.isRequireConsentForTransactional());
        if (!gated) return;

        List<ConsentRecord> records;
        try {
            records = consentRepository.findByTenantIdAndPhoneNumber(tenantId, to);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Consent lookup failed for tenant={} to={}, proceeding without consent check: {}",
                    tenantId, to, e.getMessage());
            return;
        }

        boolean optedOutOfAll = records.stream().anyMatch(r ->
                r.getType() == ConsentType.ALL && r.getStatus() == ConsentStatus.OPTED_OUT);
        boolean allowed = !optedOutOfAll && records.stream().anyMatch(r -> allows(r, category));
        if (!allowed) {
            metrics.recordConsentDenied(category.name());
            auditService.logDenial(AuditEvent.TYPE_CONSENT_DENIED, tenantId,
                    category + " send to " + to + " has no valid consent");
            log.warn("Consent denied tenant={} to={} category={}", tenantId, to, category);
            throw new ConsentDeniedException(category, "No valid " + category.name().toLowerCase()
                    + " consent for recipient");
        }
    }

    private boolean allows(ConsentRecord record, MessageCategory category) {
        if (category == MessageCategory.MARKETING) {
            return consentEngine.allowsMarketing(record.getStatus(), record.getType(), record.getOptInDate())
                    && !consentEngine.isExpired(record.getOptInDate(), record.getMetadata());
        }
        return consentEngine.allowsTransactional(record.getStatus(), record.getType());
    }

    private RateLimitResult enforceRateLimit(String tenantId, MessageType messageType) {
        RateLimitResult rate = rateLimiter.checkAndIncrement(tenantId, messageType);
        if (!rate.allowed()) {
            auditService.logDenial(AuditEvent.TYPE_RATE_LIMITED, tenantId,
                    rate.limitType().lowerName() + " limit " + rate.limit() + " reached");
            throw new RateLimitExceededException(rate.limitType(), rate.resetTime(), rate.limit());
        }
        return rate;
    }

    private SendResult deliver(Message message, boolean rateLimitDegraded) {
        lifecycle.applyTransition(message, MessageStatus.SENDING);
        message = messageRepository.save(message);

        GatewayReceipt receipt;
        try {
            receipt = callGateway(message);
        } catch (GatewayException e) {
            return handleGatewayFailure(message, e, rateLimitDegraded);
        }

        message.setExternalId(receipt.externalId());
        lifecycle.applyTransition(message, MessageStatus.SENT);
        message = messageRepository.save(message);

        metrics.recordMessageSent(message.getChannel().lowerName());
        auditService.logMessageEvent(AuditEvent.TYPE_MESSAGE_SENT, message.getTenantId(),
                String.valueOf(message.getId()), "SEND", "SUCCESS");
        log.info("Message sent id={} externalId={}", message.getId(), message.getExternalId());
        return SendResult.of(message, false, rateLimitDegraded);
    }

    private GatewayReceipt callGateway(Message message) {
        Timer.Sample sample = metrics.startGatewayTimer();
        try {
            GatewayReceipt receipt = smsGateway.send(message.getFromAddress(), message.getToAddress(),
                            message.getContent())
                    .timeout(dispatchProperties.getGatewayTimeout())
                    .block();
            if (receipt == null || receipt.externalId() == null) {
                throw new GatewayException("empty_response", "Gateway returned no message id");
            }
            metrics.stopGatewayTimer(sample, "success");
            return receipt;
        } catch (RuntimeException e) {
            metrics.stopGatewayTimer(sample, "failure");
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof GatewayException ge) {
                throw ge;
            }
            if (cause instanceof TimeoutException) {
                throw new GatewayException("timeout",
                        "Gateway did not answer within " + dispatchProperties.getGatewayTimeout(), cause);
            }
            throw new GatewayException("gateway_error", String.valueOf(cause.getMessage()), cause);
        }
    }

    private SendResult handleGatewayFailure(Message message, GatewayException failure, boolean rateLimitDegraded) {
        lifecycle.applyTransition(message, MessageStatus.FAILED);
        message.setError(failure.getErrorCode(), failure.getMessage());
        message = messageRepository.save(message);

        boolean retryScheduled = false;
        if (message.getRetryCount() < dispatchProperties.getMaxRetries()) {
            try {
                retryJobQueue.enqueue(RETRY_JOB,
                        Map.of("tenantId", message.getTenantId(), "messageId", message.getId().toString()),
                        new JobOptions(dispatchProperties.getRetryJobPriority(), dispatchProperties.getMaxRetries()));
                retryScheduled = true;
            } catch (RuntimeException e) {
                log.error("Failed to enqueue retry for message id={}", message.getId(), e);
            }
        }

        metrics.recordMessageFailed(message.getChannel().lowerName(), retryScheduled);
        auditService.logMessageEvent(AuditEvent.TYPE_DELIVERY_FAILED, message.getTenantId(),
                String.valueOf(message.getId()), "SEND", retryScheduled ? "RETRY_SCHEDULED" : "FAILED");
        log.warn("Gateway send failed id={} code={} retryScheduled={}: {}",
                message.getId(), failure.getErrorCode(), retryScheduled, failure.getMessage());

        if (!retryScheduled) {
            throw new GatewayException(failure.getErrorCode(),
                    "Send failed for message " + message.getId() + " after " + message.getRetryCount()
                            + " retries: " + failure.getMessage(), failure);
        }
        return SendResult.of(message, true, rateLimitDegraded);
    }

    private String lookupContact(String normalizedPhone) {
        try {
            return contactDirectory.findContactByPhone(normalizedPhone).map(Contact::id).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Contact lookup failed, storing message without contact link: {}", e.getMessage());
            return null;
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value.length() > max) {
            throw new ValidationException(field, "exceeds " + max + " characters");
        }
    }
}
