package com.smsgate.ratelimit;

import com.smsgate.config.SmsGateProperties;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class TenantTierResolver {

    private final Map<String, String> tenantTiers;
    private final TenantTier defaultTier;

    public TenantTierResolver(SmsGateProperties properties) {
        this.tenantTiers = Map.copyOf(properties.getRateLimit().getTenantTiers());
        this.defaultTier = TenantTier.fromName(properties.getRateLimit().getDefaultTier());
    }

    public TenantTier tierFor(String tenantId) {
        String configured = tenantId != null ? tenantTiers.get(tenantId) : null;
        return configured != null ? TenantTier.fromName(configured) : defaultTier;
    }
}
