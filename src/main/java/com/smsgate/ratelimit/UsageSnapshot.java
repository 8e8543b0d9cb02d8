package com.smsgate.ratelimit;

public record UsageSnapshot(WindowUsage minute, WindowUsage hour, WindowUsage day, boolean degraded) {

    public WindowUsage forWindow(RateWindow window) {
        return switch (window) {
            case MINUTE -> minute;
            case HOUR -> hour;
            case DAY -> day;
        };
    }

    static UsageSnapshot empty(WindowLimits limits) {
        return new UsageSnapshot(
                WindowUsage.of(0, limits.minute()),
                WindowUsage.of(0, limits.hour()),
                WindowUsage.of(0, limits.day()),
                true);
    }
}
