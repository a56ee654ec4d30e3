package com.spiderjobs.crawl.model;

import java.time.Instant;

/**
 * A pending fetch of one URL for one site.
 *
 * <p>Instances are immutable; retry bookkeeping produces a new task through
 * {@link #nextAttempt(Instant)} and {@link #nextBlockedAttempt(Instant)}.
 */
public record FetchTask(
    String url,
    String siteId,
    int depth,
    int priority,
    Instant enqueueTime,
    int attemptCount,
    int blockedCount,
    Instant notBefore
) {
    public static FetchTask seed(String url, String siteId, int priority, Instant now) {
        return new FetchTask(url, siteId, 0, priority, now, 0, 0, now);
    }

    public static FetchTask discovered(String url, String siteId, int depth, int priority, Instant now) {
        return new FetchTask(url, siteId, depth, priority, now, 0, 0, now);
    }

    public FetchTask nextAttempt(Instant eligibleAt) {
        return new FetchTask(url, siteId, depth, priority, enqueueTime, attemptCount + 1, blockedCount, eligibleAt);
    }

    public FetchTask nextBlockedAttempt(Instant eligibleAt) {
        return new FetchTask(url, siteId, depth, priority, enqueueTime, attemptCount, blockedCount + 1, eligibleAt);
    }

    public FetchTask deferredUntil(Instant eligibleAt) {
        return new FetchTask(url, siteId, depth, priority, enqueueTime, attemptCount, blockedCount, eligibleAt);
    }
}
