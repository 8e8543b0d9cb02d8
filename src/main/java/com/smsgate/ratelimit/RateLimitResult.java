package com.smsgate.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a rate-limit check. For a denial, {@code limitType} names the first window
 * that was exceeded; for an allowed send it is {@link LimitType#NONE} and the numbers
 * describe the window with the least headroom.
 */
public record RateLimitResult(
        boolean allowed,
        LimitType limitType,
        long current,
        long limit,
        long remaining,
        Instant resetTime,
        boolean degraded
) {
    static final Duration FAIL_OPEN_RESET = Duration.ofSeconds(60);

    public static RateLimitResult allowed(long current, long limit, long remaining, Instant resetTime) {
        return new RateLimitResult(true, LimitType.NONE, current, limit, remaining, resetTime, false);
    }

    public static RateLimitResult denied(LimitType limitType, long current, long limit, Instant resetTime) {
        return new RateLimitResult(false, limitType, current, limit, 0, resetTime, false);
    }

    /**
     * Policy used when the counter store is unavailable: let the send through and flag it.
     */
    public static RateLimitResult failOpen(long minuteLimit, Instant now) {
        return new RateLimitResult(true, LimitType.NONE, 0, minuteLimit, 0, now.plus(FAIL_OPEN_RESET), true);
    }

    public long retryAfterSeconds(Instant now) {
        return Math.max(1, Duration.between(now, resetTime).toSeconds());
    }
}
