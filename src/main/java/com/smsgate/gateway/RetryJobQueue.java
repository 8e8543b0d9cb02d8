package com.smsgate.gateway;

import java.util.Map;
import java.util.Optional;

public interface RetryJobQueue {

    void enqueue(String jobName, Map<String, Object> payload, JobOptions options);

    /**
     * Removes and returns the oldest job for {@code jobName}, or empty when the list is drained.
     */
    Optional<RetryJob> poll(String jobName);
}
