package com.smsgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Centralized Micrometer metrics for the gating and dispatch paths.
 * Tenant ids are deliberately not used as tags to keep cardinality bounded.
 */
@Component
public class SmsGateMetrics {

    private final MeterRegistry registry;

    public SmsGateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Message metrics ---

    public void recordMessageSent(String messageType) {
        Counter.builder("smsgate.messages.sent")
                .tag("type", messageType)
                .register(registry).increment();
    }

    public void recordMessageFailed(String messageType, boolean retryScheduled) {
        Counter.builder("smsgate.messages.failed")
                .tag("type", messageType)
                .tag("retry", String.valueOf(retryScheduled))
                .register(registry).increment();
    }

    public void recordMessageReceived() {
        Counter.builder("smsgate.messages.received")
                .register(registry).increment();
    }

    public void recordDuplicateWebhook() {
        Counter.builder("smsgate.webhooks.duplicates")
                .register(registry).increment();
    }

    // --- Gate metrics ---

    public void recordRateLimitExceeded(String window) {
        Counter.builder("smsgate.rate_limit.exceeded")
                .tag("window", window)
                .register(registry).increment();
    }

    public void recordRateLimitDegraded(String operation) {
        Counter.builder("smsgate.rate_limit.degraded")
                .tag("operation", operation)
                .register(registry).increment();
    }

    public void recordConsentDenied(String category) {
        Counter.builder("smsgate.consent.denied")
                .tag("category", category)
                .register(registry).increment();
    }

    // --- Gateway metrics ---

    public Timer.Sample startGatewayTimer() {
        return Timer.start(registry);
    }

    public void stopGatewayTimer(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder("smsgate.gateway.latency")
                .tag("outcome", outcome)
                .register(registry));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
