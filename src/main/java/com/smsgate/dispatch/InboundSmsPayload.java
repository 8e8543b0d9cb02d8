package com.smsgate.dispatch;

public record InboundSmsPayload(String externalId, String from, String to, String body, String tenantId) {}
