package com.smsgate.dispatch;

import com.smsgate.ratelimit.LimitType;

import java.time.Instant;

public class RateLimitExceededException extends RuntimeException {

    private final LimitType limitType;
    private final Instant resetTime;
    private final long limit;

    public RateLimitExceededException(LimitType limitType, Instant resetTime, long limit) {
        super("Rate limit exceeded for " + limitType.lowerName() + " window (limit " + limit + ")");
        this.limitType = limitType;
        this.resetTime = resetTime;
        this.limit = limit;
    }

    public LimitType getLimitType() { return limitType; }
    public Instant getResetTime() { return resetTime; }
    public long getLimit() { return limit; }
}
