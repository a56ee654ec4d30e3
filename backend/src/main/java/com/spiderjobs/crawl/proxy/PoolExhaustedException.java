package com.spiderjobs.crawl.proxy;

import java.time.Instant;

/**
 * No identity is eligible. Callers must back off rather than fetch without one.
 */
public class PoolExhaustedException extends RuntimeException {
    private final Instant nextEligibleAt;

    public PoolExhaustedException(String message, Instant nextEligibleAt) {
        super(message);
        this.nextEligibleAt = nextEligibleAt;
    }

    public Instant getNextEligibleAt() {
        return nextEligibleAt;
    }
}
