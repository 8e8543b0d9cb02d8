package com.smsgate.message;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Map;

/**
 * Applies carrier delivery-status callbacks to stored outbound messages.
 * Repeated callbacks for the status a message already has are no-ops, as are progress
 * callbacks ({@code queued}, {@code sending}, {@code sent}) that arrive after the message
 * has moved further along.
 */
@Service
public class DeliveryStatusUpdater {

    private static final Logger log = LoggerFactory.getLogger(DeliveryStatusUpdater.class);

    private static final Map<String, MessageStatus> CARRIER_STATUSES = Map.of(
            "queued", MessageStatus.QUEUED,
            "sending", MessageStatus.SENDING,
            "sent", MessageStatus.SENT,
            "delivered", MessageStatus.DELIVERED,
            "undelivered", MessageStatus.UNDELIVERED,
            "failed", MessageStatus.FAILED);

    private static final Map<MessageStatus, Integer> PROGRESS = Map.of(
            MessageStatus.QUEUED, 0,
            MessageStatus.SENDING, 1,
            MessageStatus.SENT, 2,
            MessageStatus.FAILED, 2,
            MessageStatus.DELIVERED, 3,
            MessageStatus.UNDELIVERED, 3,
            MessageStatus.CANCELED, 3);

    private final MessageRepository messageRepository;
    private final MessageLifecycle lifecycle;

    public DeliveryStatusUpdater(MessageRepository messageRepository, MessageLifecycle lifecycle) {
        this.messageRepository = messageRepository;
        this.lifecycle = lifecycle;
    }

    public static MessageStatus mapCarrierStatus(String carrierStatus) {
        MessageStatus status = carrierStatus != null
                ? CARRIER_STATUSES.get(carrierStatus.trim().toLowerCase(Locale.ROOT)) : null;
        if (status == null) {
            throw new IllegalArgumentException("Unknown carrier status: " + carrierStatus);
        }
        return status;
    }

    @Transactional
    public StatusUpdate apply(String tenantId, String externalId, String carrierStatus,
                              String errorCode, String errorMessage) {
        MessageStatus target = mapCarrierStatus(carrierStatus);
        Message message = messageRepository.findByTenantIdAndExternalId(tenantId, externalId)
                .orElseThrow(() -> new MessageNotFoundException(tenantId, externalId));

        MessageStatus previous = message.getStatus();
        if (previous == target) {
            log.debug("Duplicate status callback ignored: message={} status={}", message.getId(), target);
            return new StatusUpdate(message.getId().toString(), false, previous, previous);
        }
        if (isStaleProgress(previous, target)) {
            log.debug("Stale status callback ignored: message={} current={} reported={}",
                    message.getId(), previous, target);
            return new StatusUpdate(message.getId().toString(), false, previous, previous);
        }

        lifecycle.applyTransition(message, target);
        if (target == MessageStatus.FAILED || target == MessageStatus.UNDELIVERED) {
            message.setError(errorCode, errorMessage);
        }
        messageRepository.save(message);
        log.info("Message status updated: message={} {} -> {}", message.getId(), previous, target);
        return new StatusUpdate(message.getId().toString(), true, previous, target);
    }

    static boolean isStaleProgress(MessageStatus current, MessageStatus reported) {
        boolean progress = reported == MessageStatus.QUEUED
                || reported == MessageStatus.SENDING
                || reported == MessageStatus.SENT;
        return progress && PROGRESS.get(reported) < PROGRESS.get(current);
    }

    public record StatusUpdate(String messageId, boolean updated,
                               MessageStatus previousStatus, MessageStatus newStatus) {}
}
