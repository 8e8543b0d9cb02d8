package com.smsgate.ratelimit;

/**
 * Raised by a {@link CounterStore} when the backing store cannot be reached or answers
 * with an error. The rate limiter absorbs it and fails open.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreUnavailableException(String message) {
        super(message);
    }
}
