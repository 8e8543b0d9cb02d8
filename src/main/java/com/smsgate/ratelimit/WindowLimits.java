package com.smsgate.ratelimit;

public record WindowLimits(int minute, int hour, int day) {

    public int forWindow(RateWindow window) {
        return switch (window) {
            case MINUTE -> minute;
            case HOUR -> hour;
            case DAY -> day;
        };
    }
}
