package com.smsgate.ratelimit;

import java.util.Locale;

public enum TenantTier {
    FREE,
    BASIC,
    PREMIUM,
    ENTERPRISE;

    public static TenantTier fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tenant tier is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tenant tier: " + name);
        }
    }
}
