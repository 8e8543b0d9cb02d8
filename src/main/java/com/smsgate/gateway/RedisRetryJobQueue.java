package com.smsgate.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smsgate.config.SmsGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Job envelopes on a Redis list per job name ({@code smsgate:jobs:<jobName>}).
 * Producers push on the left; {@link #poll} pops from the right, so jobs drain oldest first.
 */
@Component
public class RedisRetryJobQueue implements RetryJobQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisRetryJobQueue.class);

    static final String QUEUE_PREFIX = "smsgate:jobs:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration timeout;

    public RedisRetryJobQueue(ReactiveRedisTemplate<String, String> redisTemplate,
                              ObjectMapper objectMapper,
                              Clock clock,
                              SmsGateProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeout = properties.getRedis().getCommandTimeout();
    }

    @Override
    public void enqueue(String jobName, Map<String, Object> payload, JobOptions options) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("jobName", jobName);
        envelope.put("payload", payload);
        envelope.put("priority", options.priority());
        envelope.put("maxAttempts", options.maxAttempts());
        envelope.put("enqueuedAt", clock.instant().toString());

        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + jobName, e);
        }

        Long depth = redisTemplate.opsForList().leftPush(QUEUE_PREFIX + jobName, json).block(timeout);
        log.info("Enqueued job={} depth={}", jobName, depth);
    }

    @Override
    public Optional<RetryJob> poll(String jobName) {
        String key = QUEUE_PREFIX + jobName;
        String json;
        while ((json = redisTemplate.opsForList().rightPop(key).block(timeout)) != null) {
            try {
                return Optional.of(parse(json));
            } catch (JsonProcessingException | RuntimeException e) {
                log.error("Dropping unreadable job from {}: {}", key, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private RetryJob parse(String json) throws JsonProcessingException {
        JsonNode envelope = objectMapper.readTree(json);
        Map<String, String> payload = new LinkedHashMap<>();
        envelope.path("payload").fields()
                .forEachRemaining(field -> payload.put(field.getKey(), field.getValue().asText()));
        JsonNode enqueuedAt = envelope.get("enqueuedAt");
        return new RetryJob(
                envelope.path("jobName").asText(),
                payload,
                envelope.path("priority").asInt(),
                envelope.path("maxAttempts").asInt(),
                enqueuedAt != null && !enqueuedAt.isNull() ? Instant.parse(enqueuedAt.asText()) : null);
    }
}
