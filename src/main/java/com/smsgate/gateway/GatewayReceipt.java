package com.smsgate.gateway;

public record GatewayReceipt(String externalId, String status) {}
