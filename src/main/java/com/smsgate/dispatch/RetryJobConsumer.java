package com.smsgate.dispatch;

import com.smsgate.config.SmsGateProperties;
import com.smsgate.gateway.GatewayException;
import com.smsgate.gateway.JobOptions;
import com.smsgate.gateway.RetryJob;
import com.smsgate.gateway.RetryJobQueue;
import com.smsgate.message.InvalidTransitionException;
import com.smsgate.message.MessageNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drains {@value DispatchCoordinator#RETRY_JOB} jobs and hands each one to
 * {@link DispatchCoordinator#retry}. A job held back by the rate limiter or by an
 * infrastructure failure goes back on the queue and ends the current pass.
 */
@Component
public class RetryJobConsumer {

    private static final Logger log = LoggerFactory.getLogger(RetryJobConsumer.class);

    private final RetryJobQueue retryJobQueue;
    private final DispatchCoordinator dispatchCoordinator;
    private final SmsGateProperties.DispatchProperties dispatchProperties;

    public RetryJobConsumer(RetryJobQueue retryJobQueue,
                            DispatchCoordinator dispatchCoordinator,
                            SmsGateProperties properties) {
        this.retryJobQueue = retryJobQueue;
        this.dispatchCoordinator = dispatchCoordinator;
        this.dispatchProperties = properties.getDispatch();
    }

    @Scheduled(fixedDelayString = "${smsgate.dispatch.retry-poll-interval-ms:5000}")
    public void drain() {
        int processed = 0;
        while (processed < dispatchProperties.getRetryBatchSize()) {
            Optional<RetryJob> job;
            try {
                job = retryJobQueue.poll(DispatchCoordinator.RETRY_JOB);
            } catch (RuntimeException e) {
                log.warn("Retry queue unavailable, skipping this pass: {}", e.getMessage());
                return;
            }
            if (job.isEmpty()) break;
            processed++;
            if (!process(job.get())) break;
        }
        if (processed > 0) {
            log.info("Processed {} retry jobs", processed);
        }
    }

    /**
     * @return false when the pass should stop because the job was put back on the queue
     */
    boolean process(RetryJob job) {
        String tenantId = job.payloadValue("tenantId");
        UUID messageId = parseMessageId(job.payloadValue("messageId"));
        if (tenantId == null || messageId == null) {
            log.error("Dropping retry job with incomplete payload: {}", job.payload());
            return true;
        }

        try {
            SendResult result = dispatchCoordinator.retry(tenantId, messageId);
            log.info("Retry job done message={} status={} retryScheduled={}",
                    messageId, result.status(), result.retryScheduled());
            return true;
        } catch (RateLimitExceededException e) {
            log.info("Retry of message={} held by {} limit until {}",
                    messageId, e.getLimitType().lowerName(), e.getResetTime());
            requeue(job);
            return false;
        } catch (GatewayException e) {
            log.warn("Retries exhausted for message={}: {}", messageId, e.getMessage());
            return true;
        } catch (ConsentDeniedException | InvalidTransitionException | MessageNotFoundException e) {
            log.info("Retry job for message={} dropped: {}", messageId, e.getMessage());
            return true;
        } catch (RuntimeException e) {
            log.error("Retry of message={} failed, requeueing", messageId, e);
            requeue(job);
            return false;
        }
    }

    private void requeue(RetryJob job) {
        Map<String, Object> payload = new LinkedHashMap<>(job.payload());
        try {
            retryJobQueue.enqueue(job.jobName(), payload, new JobOptions(job.priority(), job.maxAttempts()));
        } catch (RuntimeException e) {
            log.error("Failed to requeue retry job {}, message={} stays failed", job.jobName(),
                    payload.get("messageId"), e);
        }
    }

    private static UUID parseMessageId(String value) {
        if (value == null) return null;
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
