package com.smsgate.observability;

import com.smsgate.ratelimit.CounterStore;
import com.smsgate.ratelimit.StoreUnavailableException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the counter store. DOWN here means sends are passing the rate limiter unchecked.
 */
@Component
public class CounterStoreHealthIndicator implements HealthIndicator {

    static final String PROBE_KEY = "smsgate:health:probe";

    private final CounterStore counterStore;

    public CounterStoreHealthIndicator(CounterStore counterStore) {
        this.counterStore = counterStore;
    }

    @Override
    public Health health() {
        try {
            counterStore.get(PROBE_KEY);
            return Health.up().withDetail("rateLimiting", "enforced").build();
        } catch (StoreUnavailableException e) {
            return Health.down()
                    .withDetail("rateLimiting", "fail-open")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
