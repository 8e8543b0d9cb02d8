package com.smsgate.dispatch;

import com.smsgate.message.Message;
import com.smsgate.message.MessageStatus;

import java.util.UUID;

/**
 * @param retryScheduled true when the gateway failed and a retry job was queued
 * @param rateLimitDegraded true when the rate limiter could not reach its store and let the send through
 */
public record SendResult(
        UUID messageId,
        MessageStatus status,
        String externalId,
        int retryCount,
        boolean retryScheduled,
        boolean rateLimitDegraded
) {
    static SendResult of(Message message, boolean retryScheduled, boolean rateLimitDegraded) {
        return new SendResult(message.getId(), message.getStatus(), message.getExternalId(),
                message.getRetryCount(), retryScheduled, rateLimitDegraded);
    }
}
