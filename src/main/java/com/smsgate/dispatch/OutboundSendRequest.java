package com.smsgate.dispatch;

import com.smsgate.message.MessageCategory;
import com.smsgate.message.MessageType;

public record OutboundSendRequest(
        String tenantId,
        String to,
        String from,
        String content,
        String contactId,
        MessageType messageType,
        MessageCategory category
) {}
