package com.smsgate.ratelimit;

public record WindowUsage(long current, long limit, long remaining) {

    public static WindowUsage of(long current, long limit) {
        return new WindowUsage(current, limit, Math.max(0, limit - current));
    }
}
