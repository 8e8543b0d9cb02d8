package com.smsgate.ratelimit;

import java.util.List;

/**
 * Shared atomic counter store. Every method raises {@link StoreUnavailableException}
 * when the store cannot serve the call.
 */
public interface CounterStore {

    long increment(String key);

    void expire(String key, long seconds);

    /**
     * Atomically increments the key and sets its expiry when it has none.
     * Returns the post-increment count.
     */
    long incrementAndExpire(String key, long seconds);

    /** Current count, 0 when the key is absent. */
    long get(String key);

    /** Remaining time to live in seconds; negative when the key is absent or has no expiry. */
    long ttlRemaining(String key);

    long delete(String... keys);

    /** Keys currently present that start with {@code prefix}. */
    List<String> keysWithPrefix(String prefix);
}
