package com.spiderjobs.crawl.governor;

import java.time.Duration;

/**
 * Either a {@link Permit} or the time the caller should wait before asking again.
 */
public record GovernorDecision(Permit permit, Duration retryAfter, DenialReason reason) {

    public enum DenialReason {
        PAUSED,
        CIRCUIT_OPEN,
        CONCURRENCY,
        RATE_LIMITED,
        UNKNOWN_SITE
    }

    static GovernorDecision granted(Permit permit) {
        return new GovernorDecision(permit, Duration.ZERO, null);
    }

    static GovernorDecision denied(DenialReason reason, Duration wait) {
        return new GovernorDecision(null, wait.isNegative() ? Duration.ZERO : wait, reason);
    }

    public boolean isGranted() {
        return permit != null;
    }
}
