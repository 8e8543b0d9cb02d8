package com.smsgate.ratelimit;

import com.smsgate.config.SmsGateProperties;
import com.smsgate.config.SmsGateProperties.WindowLimitProperties;
import com.smsgate.message.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static tier table of per-window send limits. Built once from
 * {@code smsgate.rate-limit.tiers}; every tier must define every message type.
 */
@Component
public class RateLimitCalculator {

    private static final Logger log = LoggerFactory.getLogger(RateLimitCalculator.class);

    private final Map<TenantTier, Map<MessageType, WindowLimits>> table;

    public RateLimitCalculator(SmsGateProperties properties) {
        this.table = buildTable(properties.getRateLimit().getTiers());
        log.info("Rate limit table loaded for {} tiers", table.size());
    }

    public WindowLimits limits(MessageType messageType, TenantTier tier) {
        return table.get(tier).get(messageType);
    }

    private static Map<TenantTier, Map<MessageType, WindowLimits>> buildTable(
            Map<String, Map<String, WindowLimitProperties>> configured) {
        EnumMap<TenantTier, Map<MessageType, WindowLimits>> table = new EnumMap<>(TenantTier.class);
        for (TenantTier tier : TenantTier.values()) {
            Map<String, WindowLimitProperties> byType = configured.get(tier.name().toLowerCase(Locale.ROOT));
            if (byType == null) {
                throw new IllegalStateException("No rate limits configured for tier " + tier);
            }
            EnumMap<MessageType, WindowLimits> limits = new EnumMap<>(MessageType.class);
            for (MessageType type : MessageType.values()) {
                WindowLimitProperties p = byType.get(type.lowerName());
                if (p == null) {
                    throw new IllegalStateException("No rate limits configured for tier " + tier + " type " + type);
                }
                if (p.getMinute() <= 0 || p.getHour() <= 0 || p.getDay() <= 0) {
                    throw new IllegalStateException("Rate limits must be positive for tier " + tier + " type " + type);
                }
                limits.put(type, new WindowLimits(p.getMinute(), p.getHour(), p.getDay()));
            }
            table.put(tier, Collections.unmodifiableMap(limits));
        }
        return Collections.unmodifiableMap(table);
    }
}
