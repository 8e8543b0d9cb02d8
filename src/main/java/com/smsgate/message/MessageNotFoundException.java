package com.smsgate.message;

public class MessageNotFoundException extends RuntimeException {

    public MessageNotFoundException(String tenantId, String reference) {
        super("Message not found: tenant=" + tenantId + " ref=" + reference);
    }
}
