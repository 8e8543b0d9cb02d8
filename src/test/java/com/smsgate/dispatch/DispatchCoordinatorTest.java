package com.smsgate.dispatch;

import com.smsgate.MutableClock;
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
import com.smsgate.ratelimit.LimitType;
import com.smsgate.ratelimit.RateLimitResult;
import com.smsgate.ratelimit.SmsRateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DispatchCoordinatorTest {

    private static final String TENANT = "tenant-1";
    private static final String TO = "+14155238886";
    private static final String FROM = "+16502530000";

    @Mock private MessageRepository messageRepository;
    @Mock private ConsentRepository consentRepository;
    @Mock private SmsRateLimiter rateLimiter;
    @Mock private SmsGateway smsGateway;
    @Mock private RetryJobQueue retryJobQueue;
    @Mock private ContactDirectory contactDirectory;
    @Mock private AuditService auditService;

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SmsGateProperties properties = new SmsGateProperties();
    private final List<MessageStatus> savedStatuses = new ArrayList<>();

    private DispatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        properties.getDispatch().setGatewayTimeout(Duration.ofMillis(200));
        PhoneNumbers phoneNumbers = new PhoneNumbers(properties);
        coordinator = new DispatchCoordinator(messageRepository, consentRepository,
                new ConsentEngine(phoneNumbers, clock, properties), rateLimiter,
                new MessageLifecycle(clock), smsGateway, retryJobQueue, contactDirectory, phoneNumbers,
                auditService, new SmsGateMetrics(registry), properties, clock);

        when(messageRepository.save(any(Message.class))).thenAnswer(inv -> {
            Message m = inv.getArgument(0);
            if (m.getId() == null) m.setId(UUID.randomUUID());
            savedStatuses.add(m.getStatus());
            return m;
        });
        when(rateLimiter.checkAndIncrement(anyString(), any()))
                .thenReturn(RateLimitResult.allowed(1, 5, 4, clock.instant().plusSeconds(60)));
        when(smsGateway.send(anyString(), anyString(), anyString()))
                .thenReturn(Mono.just(new GatewayReceipt("SM100", "queued")));
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO))
                .thenReturn(List.of(consent(ConsentType.MARKETING, ConsentStatus.OPTED_IN,
                        Instant.parse("2026-01-01T00:00:00Z"))));
    }

    // --- outbound ---

    @Test
    void marketingSendWithConsentIsSent() {
        SendResult result = coordinator.sendOutbound(marketing("Spring sale"));

        assertEquals(MessageStatus.SENT, result.status());
        assertEquals("SM100", result.externalId());
        assertFalse(result.retryScheduled());
        assertFalse(result.rateLimitDegraded());
        assertEquals(List.of(MessageStatus.QUEUED, MessageStatus.SENDING, MessageStatus.SENT), savedStatuses);
        assertEquals(1.0, registry.counter("smsgate.messages.sent", "type", "sms").count());
        verify(smsGateway).send(FROM, TO, "Spring sale");
        verify(auditService).logMessageEvent(eq(AuditEvent.TYPE_MESSAGE_SENT), eq(TENANT), anyString(),
                eq("SEND"), eq("SUCCESS"));
    }

    @Test
    void storedMessageCarriesCategoryAndContact() {
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        coordinator.sendOutbound(new OutboundSendRequest(TENANT, TO, FROM, "hi", "contact-9",
                MessageType.SMS, MessageCategory.MARKETING));

        verify(messageRepository, atLeastOnce()).save(saved.capture());
        Message message = saved.getValue();
        assertEquals(MessageCategory.MARKETING, message.getCategory());
        assertEquals("contact-9", message.getContactId());
        assertEquals(MessageDirection.OUTBOUND, message.getDirection());
    }

    @Test
    void nonE164RecipientIsRejectedBeforeAnyGate() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> coordinator.sendOutbound(new OutboundSendRequest(TENANT, "(415) 523-8886", FROM, "hi",
                        null, MessageType.SMS, MessageCategory.MARKETING)));

        assertEquals("to", e.getField());
        verifyNoInteractions(consentRepository, rateLimiter, smsGateway);
    }

    @Test
    void missingFieldsAreRejected() {
        assertEquals("content", assertThrows(ValidationException.class,
                () -> coordinator.sendOutbound(new OutboundSendRequest(TENANT, TO, FROM, " ",
                        null, MessageType.SMS, MessageCategory.MARKETING))).getField());
        assertEquals("category", assertThrows(ValidationException.class,
                () -> coordinator.sendOutbound(new OutboundSendRequest(TENANT, TO, FROM, "hi",
                        null, MessageType.SMS, null))).getField());
        assertEquals("tenantId", assertThrows(ValidationException.class,
                () -> coordinator.sendOutbound(new OutboundSendRequest(null, TO, FROM, "hi",
                        null, MessageType.SMS, MessageCategory.MARKETING))).getField());
    }

    @Test
    void overlongSmsIsRejected() {
        String body = "x".repeat(properties.getDispatch().getSmsMaxLength() + 1);

        ValidationException e = assertThrows(ValidationException.class,
                () -> coordinator.sendOutbound(marketing(body)));
        assertEquals("content", e.getField());
    }

    @Test
    void marketingWithoutConsentIsDeniedBeforeRateLimiting() {
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO)).thenReturn(List.of());

        ConsentDeniedException e = assertThrows(ConsentDeniedException.class,
                () -> coordinator.sendOutbound(marketing("promo")));

        assertEquals(MessageCategory.MARKETING, e.getCategory());
        verifyNoInteractions(rateLimiter, smsGateway);
        verify(messageRepository, never()).save(any());
        assertEquals(1.0, registry.counter("smsgate.consent.denied", "category", "MARKETING").count());
        verify(auditService).logDenial(eq(AuditEvent.TYPE_CONSENT_DENIED), eq(TENANT), anyString());
    }

    @Test
    void optOutOfAllOverridesMarketingOptIn() {
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO)).thenReturn(List.of(
                consent(ConsentType.MARKETING, ConsentStatus.OPTED_IN, Instant.parse("2026-01-01T00:00:00Z")),
                consent(ConsentType.ALL, ConsentStatus.OPTED_OUT, null)));

        assertThrows(ConsentDeniedException.class, () -> coordinator.sendOutbound(marketing("promo")));
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void expiredMarketingConsentIsDenied() {
        ConsentRecord record = consent(ConsentType.MARKETING, ConsentStatus.OPTED_IN,
                Instant.parse("2026-01-01T00:00:00Z"));
        record.getMetadata().put(ConsentEngine.EXPIRY_DATE_KEY, "2026-02-01");
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO)).thenReturn(List.of(record));

        assertThrows(ConsentDeniedException.class, () -> coordinator.sendOutbound(marketing("promo")));
    }

    @Test
    void transactionalIsNotGatedByDefault() {
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO)).thenReturn(List.of());

        SendResult result = coordinator.sendOutbound(transactional("Your code is 1234"));

        assertEquals(MessageStatus.SENT, result.status());
        verifyNoInteractions(consentRepository);
    }

    @Test
    void transactionalGatingRequiresTransactionalConsent() {
        properties.getDispatch().setRequireConsentForTransactional(true);

        assertThrows(ConsentDeniedException.class,
                () -> coordinator.sendOutbound(transactional("Your code is 1234")));

        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO)).thenReturn(List.of(
                consent(ConsentType.TRANSACTIONAL, ConsentStatus.OPTED_IN, Instant.parse("2026-01-01T00:00:00Z"))));
        assertEquals(MessageStatus.SENT, coordinator.sendOutbound(transactional("Your code is 1234")).status());
    }

    @Test
    void consentStoreFailureDoesNotBlockSend() {
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        SendResult result = coordinator.sendOutbound(marketing("promo"));

        assertEquals(MessageStatus.SENT, result.status());
    }

    @Test
    void consentTransactionFailureDoesNotBlockSend() {
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        SendResult result = coordinator.sendOutbound(marketing("promo"));

        assertEquals(MessageStatus.SENT, result.status());
        verify(rateLimiter).checkAndIncrement(TENANT, MessageType.SMS);
        verify(smsGateway).send(FROM, TO, "promo");
    }

    @Test
    void rateLimitDenialStopsSendAndIsAudited() {
        Instant reset = clock.instant().plusSeconds(42);
        when(rateLimiter.checkAndIncrement(TENANT, MessageType.SMS))
                .thenReturn(RateLimitResult.denied(LimitType.MINUTE, 5, 5, reset));

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> coordinator.sendOutbound(marketing("promo")));

        assertEquals(LimitType.MINUTE, e.getLimitType());
        assertEquals(reset, e.getResetTime());
        assertEquals(5, e.getLimit());
        verify(messageRepository, never()).save(any());
        verifyNoInteractions(smsGateway);
        verify(auditService).logDenial(eq(AuditEvent.TYPE_RATE_LIMITED), eq(TENANT), contains("minute"));
    }

    @Test
    void degradedRateLimitIsReported() {
        when(rateLimiter.checkAndIncrement(anyString(), any()))
                .thenReturn(RateLimitResult.failOpen(5, clock.instant()));

        SendResult result = coordinator.sendOutbound(marketing("promo"));

        assertTrue(result.rateLimitDegraded());
        assertEquals(MessageStatus.SENT, result.status());
    }

    @Test
    void gatewayFailureSchedulesRetry() {
        when(smsGateway.send(anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(new GatewayException("21610", "Attempt to send to unsubscribed recipient")));

        SendResult result = coordinator.sendOutbound(marketing("promo"));

        assertEquals(MessageStatus.FAILED, result.status());
        assertTrue(result.retryScheduled());
        assertEquals(List.of(MessageStatus.QUEUED, MessageStatus.SENDING, MessageStatus.FAILED), savedStatuses);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(retryJobQueue).enqueue(eq(DispatchCoordinator.RETRY_JOB), payload.capture(), any(JobOptions.class));
        assertEquals(TENANT, payload.getValue().get("tenantId"));
        assertEquals(result.messageId().toString(), payload.getValue().get("messageId"));
        assertEquals(1.0, registry.counter("smsgate.messages.failed", "type", "sms", "retry", "true").count());
    }

    @Test
    void failureRecordsCarrierErrorOnMessage() {
        when(smsGateway.send(anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(new GatewayException("30007", "Carrier filtered")));
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        coordinator.sendOutbound(marketing("promo"));

        verify(messageRepository, atLeastOnce()).save(saved.capture());
        assertEquals("30007", saved.getValue().getErrorCode());
        assertEquals("Carrier filtered", saved.getValue().getErrorMessage());
    }

    @Test
    void timeoutIsTreatedAsGatewayFailure() {
        when(smsGateway.send(anyString(), anyString(), anyString())).thenReturn(Mono.never());
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        SendResult result = coordinator.sendOutbound(marketing("promo"));

        assertEquals(MessageStatus.FAILED, result.status());
        verify(messageRepository, atLeastOnce()).save(saved.capture());
        assertEquals("timeout", saved.getValue().getErrorCode());
    }

    @Test
    void emptyGatewayResponseIsAFailure() {
        when(smsGateway.send(anyString(), anyString(), anyString())).thenReturn(Mono.empty());
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        coordinator.sendOutbound(marketing("promo"));

        verify(messageRepository, atLeastOnce()).save(saved.capture());
        assertEquals("empty_response", saved.getValue().getErrorCode());
    }

    @Test
    void unexpectedGatewayErrorIsWrapped() {
        when(smsGateway.send(anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("connection reset")));
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        coordinator.sendOutbound(marketing("promo"));

        verify(messageRepository, atLeastOnce()).save(saved.capture());
        assertEquals("gateway_error", saved.getValue().getErrorCode());
    }

    @Test
    void exhaustedRetriesSurfaceGatewayError() {
        properties.getDispatch().setMaxRetries(0);
        when(smsGateway.send(anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(new GatewayException("30003", "Unreachable")));

        GatewayException e = assertThrows(GatewayException.class,
                () -> coordinator.sendOutbound(marketing("promo")));

        assertEquals("30003", e.getErrorCode());
        assertTrue(e.getMessage().contains("after 0 retries"));
        verifyNoInteractions(retryJobQueue);
        assertEquals(MessageStatus.FAILED, savedStatuses.get(savedStatuses.size() - 1));
    }

    @Test
    void enqueueFailureSurfacesGatewayError() {
        when(smsGateway.send(anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(new GatewayException("30003", "Unreachable")));
        doThrow(new IllegalStateException("queue down")).when(retryJobQueue).enqueue(anyString(), anyMap(), any());

        assertThrows(GatewayException.class, () -> coordinator.sendOutbound(marketing("promo")));
        assertEquals(1.0, registry.counter("smsgate.messages.failed", "type", "sms", "retry", "false").count());
    }

    // --- retry ---

    @Test
    void retryResendsFailedMessage() {
        Message failed = stored(MessageStatus.FAILED);
        when(messageRepository.findByIdAndTenantId(failed.getId(), TENANT)).thenReturn(Optional.of(failed));

        SendResult result = coordinator.retry(TENANT, failed.getId());

        assertEquals(MessageStatus.SENT, result.status());
        assertEquals(1, result.retryCount());
        assertEquals(List.of(MessageStatus.QUEUED, MessageStatus.SENDING, MessageStatus.SENT), savedStatuses);
    }

    @Test
    void retryOfDeliveredMessageIsRejected() {
        Message delivered = stored(MessageStatus.DELIVERED);
        when(messageRepository.findByIdAndTenantId(delivered.getId(), TENANT)).thenReturn(Optional.of(delivered));

        assertThrows(InvalidTransitionException.class, () -> coordinator.retry(TENANT, delivered.getId()));
        verifyNoInteractions(smsGateway);
    }

    @Test
    void retryAfterOptOutCancelsMessage() {
        Message failed = stored(MessageStatus.FAILED);
        when(messageRepository.findByIdAndTenantId(failed.getId(), TENANT)).thenReturn(Optional.of(failed));
        when(consentRepository.findByTenantIdAndPhoneNumber(TENANT, TO)).thenReturn(List.of(
                consent(ConsentType.MARKETING, ConsentStatus.OPTED_OUT, null)));

        assertThrows(ConsentDeniedException.class, () -> coordinator.retry(TENANT, failed.getId()));

        assertEquals(MessageStatus.CANCELED, failed.getStatus());
        assertEquals(List.of(MessageStatus.CANCELED), savedStatuses);
        verifyNoInteractions(smsGateway);
    }

    @Test
    void rateLimitedRetryStaysRetryableUntilWindowResets() {
        Message failed = stored(MessageStatus.UNDELIVERED);
        when(messageRepository.findByIdAndTenantId(failed.getId(), TENANT)).thenReturn(Optional.of(failed));
        when(rateLimiter.checkAndIncrement(TENANT, MessageType.SMS))
                .thenReturn(RateLimitResult.denied(LimitType.MINUTE, 5, 5, clock.instant().plusSeconds(60)));

        assertThrows(RateLimitExceededException.class, () -> coordinator.retry(TENANT, failed.getId()));
        assertEquals(MessageStatus.UNDELIVERED, failed.getStatus());
        assertEquals(0, failed.getRetryCount());
        assertTrue(savedStatuses.isEmpty());
        verifyNoInteractions(smsGateway);

        clock.advance(Duration.ofMinutes(5));
        when(rateLimiter.checkAndIncrement(TENANT, MessageType.SMS))
                .thenReturn(RateLimitResult.allowed(1, 5, 4, clock.instant().plusSeconds(60)));

        SendResult result = coordinator.retry(TENANT, failed.getId());

        assertEquals(MessageStatus.SENT, result.status());
        assertEquals(1, result.retryCount());
        assertEquals(List.of(MessageStatus.QUEUED, MessageStatus.SENDING, MessageStatus.SENT), savedStatuses);
    }

    @Test
    void retryOfUnknownMessageIsNotFound() {
        UUID id = UUID.randomUUID();
        when(messageRepository.findByIdAndTenantId(id, TENANT)).thenReturn(Optional.empty());

        assertThrows(MessageNotFoundException.class, () -> coordinator.retry(TENANT, id));
    }

    // --- inbound ---

    @Test
    void inboundMessageIsStoredWithContact() {
        when(messageRepository.findByTenantIdAndExternalId(TENANT, "SM200")).thenReturn(Optional.empty());
        when(messageRepository.saveAndFlush(any(Message.class))).thenAnswer(inv -> {
            Message m = inv.getArgument(0);
            m.setId(UUID.randomUUID());
            return m;
        });
        when(contactDirectory.findContactByPhone(TO)).thenReturn(Optional.of(new Contact("c-1", "Ada")));
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        InboundResult result = coordinator.receiveInbound(
                new InboundSmsPayload("SM200", "+1 (415) 523-8886", FROM, "STOP", TENANT));

        assertFalse(result.duplicate());
        assertTrue(result.contactMatched());
        verify(messageRepository).saveAndFlush(saved.capture());
        Message message = saved.getValue();
        assertEquals(MessageDirection.INBOUND, message.getDirection());
        assertEquals(MessageStatus.DELIVERED, message.getStatus());
        assertEquals(TO, message.getFromAddress());
        assertEquals("c-1", message.getContactId());
        assertEquals(clock.instant(), message.getDeliveredAt());
        assertEquals(1.0, registry.counter("smsgate.messages.received").count());
    }

    @Test
    void duplicateInboundWebhookIsIgnored() {
        Message existing = stored(MessageStatus.DELIVERED);
        when(messageRepository.findByTenantIdAndExternalId(TENANT, "SM200")).thenReturn(Optional.of(existing));

        InboundResult result = coordinator.receiveInbound(
                new InboundSmsPayload("SM200", TO, FROM, "hello", TENANT));

        assertTrue(result.duplicate());
        assertEquals(existing.getId(), result.messageId());
        verify(messageRepository, never()).saveAndFlush(any());
        assertEquals(1.0, registry.counter("smsgate.webhooks.duplicates").count());
    }

    @Test
    void concurrentDuplicateResolvesToWinner() {
        Message winner = stored(MessageStatus.DELIVERED);
        when(messageRepository.findByTenantIdAndExternalId(TENANT, "SM200"))
                .thenReturn(Optional.empty(), Optional.of(winner));
        when(messageRepository.saveAndFlush(any(Message.class)))
                .thenThrow(new DataIntegrityViolationException("uk_messages_tenant_external"));

        InboundResult result = coordinator.receiveInbound(
                new InboundSmsPayload("SM200", TO, FROM, "hello", TENANT));

        assertTrue(result.duplicate());
        assertEquals(winner.getId(), result.messageId());
    }

    @Test
    void contactLookupFailureStillStoresMessage() {
        when(messageRepository.findByTenantIdAndExternalId(TENANT, "SM200")).thenReturn(Optional.empty());
        when(messageRepository.saveAndFlush(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));
        when(contactDirectory.findContactByPhone(anyString())).thenThrow(new IllegalStateException("directory down"));

        InboundResult result = coordinator.receiveInbound(
                new InboundSmsPayload("SM200", TO, FROM, "hello", TENANT));

        assertFalse(result.duplicate());
        assertFalse(result.contactMatched());
        verify(messageRepository).saveAndFlush(any(Message.class));
    }

    @Test
    void unparseableSenderIsKeptVerbatim() {
        when(messageRepository.findByTenantIdAndExternalId(TENANT, "SM201")).thenReturn(Optional.empty());
        when(messageRepository.saveAndFlush(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);

        coordinator.receiveInbound(new InboundSmsPayload("SM201", "SHORTCODE", FROM, "hello", TENANT));

        verify(messageRepository).saveAndFlush(saved.capture());
        assertEquals("SHORTCODE", saved.getValue().getFromAddress());
        verifyNoInteractions(contactDirectory);
    }

    @Test
    void inboundRequiresAllFields() {
        assertEquals("body", assertThrows(ValidationException.class, () -> coordinator.receiveInbound(
                new InboundSmsPayload("SM1", TO, FROM, "", TENANT))).getField());
        assertEquals("externalId", assertThrows(ValidationException.class, () -> coordinator.receiveInbound(
                new InboundSmsPayload(null, TO, FROM, "hi", TENANT))).getField());
        assertEquals("from", assertThrows(ValidationException.class, () -> coordinator.receiveInbound(
                new InboundSmsPayload("SM1", "1".repeat(33), FROM, "hi", TENANT))).getField());
        verifyNoInteractions(messageRepository);
    }

    private OutboundSendRequest marketing(String content) {
        return new OutboundSendRequest(TENANT, TO, FROM, content, null, MessageType.SMS, MessageCategory.MARKETING);
    }

    private OutboundSendRequest transactional(String content) {
        return new OutboundSendRequest(TENANT, TO, FROM, content, null, MessageType.SMS,
                MessageCategory.TRANSACTIONAL);
    }

    private Message stored(MessageStatus status) {
        Message message = new Message(TENANT, MessageDirection.OUTBOUND, MessageType.SMS, FROM, TO, "promo");
        message.setId(UUID.randomUUID());
        message.setCategory(MessageCategory.MARKETING);
        message.setStatus(status);
        return message;
    }

    private static ConsentRecord consent(ConsentType type, ConsentStatus status, Instant optIn) {
        ConsentRecord record = new ConsentRecord(TENANT, TO, type);
        record.setStatus(status);
        record.setOptInDate(optIn);
        return record;
    }
}
