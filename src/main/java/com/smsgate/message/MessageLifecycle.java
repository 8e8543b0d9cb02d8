package com.smsgate.message;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Message delivery state machine.
 * <pre>
 * QUEUED -> SENDING | CANCELED
 * SENDING -> SENT | FAILED
 * SENT -> DELIVERED | UNDELIVERED
 * FAILED | UNDELIVERED -> QUEUED   (retry)
 * DELIVERED, CANCELED              (terminal)
 * </pre>
 */
@Component
public class MessageLifecycle {

    private static final Map<MessageStatus, Set<MessageStatus>> TRANSITIONS = buildTransitions();

    private final Clock clock;

    public MessageLifecycle(Clock clock) {
        this.clock = clock;
    }

    public boolean isValidTransition(MessageStatus from, MessageStatus to) {
        if (from == null || to == null) return false;
        return TRANSITIONS.get(from).contains(to);
    }

    public boolean isTerminal(MessageStatus status) {
        return status == MessageStatus.DELIVERED || status == MessageStatus.CANCELED;
    }

    public boolean isRetryableFailure(MessageStatus status) {
        return status == MessageStatus.FAILED || status == MessageStatus.UNDELIVERED;
    }

    public Set<MessageStatus> allowedTransitions(MessageStatus from) {
        return TRANSITIONS.get(from);
    }

    public Message applyTransition(Message message, MessageStatus to) {
        MessageStatus from = message.getStatus();
        if (!isValidTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }

        Instant now = clock.instant();
        if (isRetryableFailure(from) && to == MessageStatus.QUEUED) {
            message.setRetryCount(message.getRetryCount() + 1);
        }
        if (to == MessageStatus.DELIVERED) {
            message.setDeliveredAt(now);
        }
        message.setStatus(to);
        message.setUpdatedAt(now);
        return message;
    }

    private static Map<MessageStatus, Set<MessageStatus>> buildTransitions() {
        EnumMap<MessageStatus, Set<MessageStatus>> table = new EnumMap<>(MessageStatus.class);
        table.put(MessageStatus.QUEUED, immutable(EnumSet.of(MessageStatus.SENDING, MessageStatus.CANCELED)));
        table.put(MessageStatus.SENDING, immutable(EnumSet.of(MessageStatus.SENT, MessageStatus.FAILED)));
        table.put(MessageStatus.SENT, immutable(EnumSet.of(MessageStatus.DELIVERED, MessageStatus.UNDELIVERED)));
        table.put(MessageStatus.FAILED, immutable(EnumSet.of(MessageStatus.QUEUED)));
        table.put(MessageStatus.UNDELIVERED, immutable(EnumSet.of(MessageStatus.QUEUED)));
        table.put(MessageStatus.DELIVERED, immutable(EnumSet.noneOf(MessageStatus.class)));
        table.put(MessageStatus.CANCELED, immutable(EnumSet.noneOf(MessageStatus.class)));
        return Collections.unmodifiableMap(table);
    }

    private static Set<MessageStatus> immutable(EnumSet<MessageStatus> set) {
        return Collections.unmodifiableSet(set);
    }
}
