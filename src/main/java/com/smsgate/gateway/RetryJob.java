package com.smsgate.gateway;

import java.time.Instant;
import java.util.Map;

public record RetryJob(String jobName, Map<String, String> payload, int priority, int maxAttempts,
                       Instant enqueuedAt) {

    public String payloadValue(String key) {
        return payload.get(key);
    }
}
