package com.smsgate.ratelimit;

import java.util.Locale;

/**
 * Which window caused a denial, or NONE when the send was allowed.
 */
public enum LimitType {
    NONE,
    MINUTE,
    HOUR,
    DAY;

    public static LimitType of(RateWindow window) {
        return switch (window) {
            case MINUTE -> MINUTE;
            case HOUR -> HOUR;
            case DAY -> DAY;
        };
    }

    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
