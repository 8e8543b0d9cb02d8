package com.smsgate.gateway;

public record JobOptions(int priority, int maxAttempts) {}
