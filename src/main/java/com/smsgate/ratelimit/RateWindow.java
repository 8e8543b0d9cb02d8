package com.smsgate.ratelimit;

import java.time.Duration;
import java.util.Locale;

public enum RateWindow {
    MINUTE(60),
    HOUR(3_600),
    DAY(86_400);

    private final long seconds;

    RateWindow(long seconds) {
        this.seconds = seconds;
    }

    public long seconds() {
        return seconds;
    }

    public Duration duration() {
        return Duration.ofSeconds(seconds);
    }

    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RateWindow fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rate window is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rate window: " + name);
        }
    }
}
