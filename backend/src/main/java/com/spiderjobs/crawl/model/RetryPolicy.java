package com.spiderjobs.crawl.model;

import java.time.Duration;

public record RetryPolicy(
    int maxAttempts,
    Duration baseBackoff,
    Duration maxBackoff,
    int maxBlockedAttempts
) {
    /**
     * Exponential backoff for the given 1-based attempt, capped at {@code maxBackoff}.
     */
    public Duration backoffFor(int attempt) {
        long base = baseBackoff.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = base * (1L << shift);
        if (delay < 0 || delay > maxBackoff.toMillis()) {
            delay = maxBackoff.toMillis();
        }
        return Duration.ofMillis(delay);
    }
}
