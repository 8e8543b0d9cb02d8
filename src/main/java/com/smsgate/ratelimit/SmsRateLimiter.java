package com.smsgate.ratelimit;

import com.smsgate.message.MessageType;
import com.smsgate.observability.SmsGateMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-window (minute, hour, day) per-tenant rate limiter over a shared {@link CounterStore}.
 * <p>
 * {@link #checkAndIncrement} counts every attempt in all three windows, including attempts
 * that end up denied; increments are never rolled back. When the store is unavailable the
 * limiter fails open and marks the result as degraded.
 */
@Service
public class SmsRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SmsRateLimiter.class);

    private final CounterStore counterStore;
    private final RateLimitKeyGenerator keyGenerator;
    private final RateLimitCalculator calculator;
    private final TenantTierResolver tierResolver;
    private final SmsGateMetrics metrics;
    private final Clock clock;

    public SmsRateLimiter(CounterStore counterStore,
                          RateLimitKeyGenerator keyGenerator,
                          RateLimitCalculator calculator,
                          TenantTierResolver tierResolver,
                          SmsGateMetrics metrics,
                          Clock clock) {
        this.counterStore = counterStore;
        this.keyGenerator = keyGenerator;
        this.calculator = calculator;
        this.tierResolver = tierResolver;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RateLimitResult checkAndIncrement(String tenantId, MessageType messageType) {
        requireTenant(tenantId);
        WindowLimits limits = limitsFor(tenantId, messageType);
        Instant now = clock.instant();

        Map<RateWindow, Long> counts = new EnumMap<>(RateWindow.class);
        try {
            for (RateWindow window : RateWindow.values()) {
                String key = keyGenerator.key(tenantId, messageType, window);
                counts.put(window, counterStore.incrementAndExpire(key, window.seconds()));
            }
        } catch (StoreUnavailableException e) {
            return failOpen("checkAndIncrement", tenantId, limits, now, e);
        }

        for (RateWindow window : RateWindow.values()) {
            long count = counts.get(window);
            int limit = limits.forWindow(window);
            if (count > limit) {
                metrics.recordRateLimitExceeded(window.lowerName());
                log.warn("Rate limit exceeded tenant={} type={} window={} count={} limit={}",
                        tenantId, messageType, window, count, limit);
                return RateLimitResult.denied(LimitType.of(window), count - 1, limit,
                        resetTime(tenantId, messageType, window, now));
            }
        }

        RateWindow tightest = tightestWindow(counts, limits);
        long current = counts.get(tightest);
        int limit = limits.forWindow(tightest);
        return RateLimitResult.allowed(current, limit, limit - current,
                resetTime(tenantId, messageType, tightest, now));
    }

    /**
     * Reports whether the next send would be allowed without counting it.
     */
    public RateLimitResult checkOnly(String tenantId, MessageType messageType) {
        requireTenant(tenantId);
        WindowLimits limits = limitsFor(tenantId, messageType);
        Instant now = clock.instant();

        Map<RateWindow, Long> counts = new EnumMap<>(RateWindow.class);
        try {
            for (RateWindow window : RateWindow.values()) {
                counts.put(window, counterStore.get(keyGenerator.key(tenantId, messageType, window)));
            }
        } catch (StoreUnavailableException e) {
            return failOpen("checkOnly", tenantId, limits, now, e);
        }

        for (RateWindow window : RateWindow.values()) {
            long current = counts.get(window);
            int limit = limits.forWindow(window);
            if (current >= limit) {
                return RateLimitResult.denied(LimitType.of(window), current, limit,
                        resetTime(tenantId, messageType, window, now));
            }
        }

        RateWindow tightest = tightestWindow(counts, limits);
        long current = counts.get(tightest);
        int limit = limits.forWindow(tightest);
        return RateLimitResult.allowed(current, limit, limit - current,
                resetTime(tenantId, messageType, tightest, now));
    }

    public UsageSnapshot getCurrentUsage(String tenantId, MessageType messageType) {
        requireTenant(tenantId);
        WindowLimits limits = limitsFor(tenantId, messageType);
        try {
            return new UsageSnapshot(
                    usage(tenantId, messageType, RateWindow.MINUTE, limits),
                    usage(tenantId, messageType, RateWindow.HOUR, limits),
                    usage(tenantId, messageType, RateWindow.DAY, limits),
                    false);
        } catch (StoreUnavailableException e) {
            log.warn("Counter store unavailable, reporting empty usage for tenant={} type={}: {}",
                    tenantId, messageType, e.getMessage());
            metrics.recordRateLimitDegraded("getCurrentUsage");
            return UsageSnapshot.empty(limits);
        }
    }

    /**
     * Deletes the counter for one window, or all three when {@code window} is null.
     * Store failures propagate to the caller.
     */
    public long resetLimits(String tenantId, MessageType messageType, RateWindow window) {
        requireTenant(tenantId);
        String[] keys = window != null
                ? new String[] {keyGenerator.key(tenantId, messageType, window)}
                : keyGenerator.keys(tenantId, messageType).toArray(new String[0]);
        long deleted = counterStore.delete(keys);
        log.info("Rate limits reset tenant={} type={} window={} deleted={}",
                tenantId, messageType, window != null ? window : "ALL", deleted);
        return deleted;
    }

    /**
     * Counters that currently exist for the tenant. Store failures propagate.
     */
    public List<RateLimitKeyGenerator.ParsedKey> activeCounters(String tenantId) {
        requireTenant(tenantId);
        List<RateLimitKeyGenerator.ParsedKey> parsed = new ArrayList<>();
        for (String key : counterStore.keysWithPrefix(keyGenerator.tenantPrefix(tenantId))) {
            RateLimitKeyGenerator.ParsedKey p = keyGenerator.parse(key);
            if (p != null) parsed.add(p);
        }
        return parsed;
    }

    private WindowUsage usage(String tenantId, MessageType messageType, RateWindow window, WindowLimits limits) {
        long current = counterStore.get(keyGenerator.key(tenantId, messageType, window));
        return WindowUsage.of(current, limits.forWindow(window));
    }

    private RateWindow tightestWindow(Map<RateWindow, Long> counts, WindowLimits limits) {
        RateWindow tightest = RateWindow.MINUTE;
        long best = Long.MAX_VALUE;
        for (RateWindow window : RateWindow.values()) {
            long remaining = limits.forWindow(window) - counts.get(window);
            // strict comparison keeps the smaller window on ties
            if (remaining < best) {
                best = remaining;
                tightest = window;
            }
        }
        return tightest;
    }

    private Instant resetTime(String tenantId, MessageType messageType, RateWindow window, Instant now) {
        try {
            long ttl = counterStore.ttlRemaining(keyGenerator.key(tenantId, messageType, window));
            if (ttl > 0) {
                return now.plusSeconds(ttl);
            }
        } catch (StoreUnavailableException e) {
            log.debug("TTL lookup failed for tenant={} window={}: {}", tenantId, window, e.getMessage());
        }
        return now.plus(window.duration());
    }

    private RateLimitResult failOpen(String operation, String tenantId, WindowLimits limits,
                                     Instant now, StoreUnavailableException e) {
        log.warn("Counter store unavailable during {} for tenant={}, allowing send: {}",
                operation, tenantId, e.getMessage());
        metrics.recordRateLimitDegraded(operation);
        return RateLimitResult.failOpen(limits.minute(), now);
    }

    private WindowLimits limitsFor(String tenantId, MessageType messageType) {
        return calculator.limits(messageType, tierResolver.tierFor(tenantId));
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }
}
