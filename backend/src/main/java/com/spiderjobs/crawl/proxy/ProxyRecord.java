package com.spiderjobs.crawl.proxy;

import com.spiderjobs.crawl.model.ProxyHealthSnapshot;
import com.spiderjobs.crawl.model.ProxyIdentity;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable health of one identity. All updates are synchronized on the record.
 */
public class ProxyRecord {
    static final double MAX_HEALTH = 1.0;
    static final double MIN_HEALTH = 0.05;
    private static final double FAILURE_PENALTY = 0.1;
    private static final double SUCCESS_RECOVERY = 0.05;

    private final ProxyIdentity identity;
    private double healthScore = MAX_HEALTH;
    private Instant lastUsed;
    private int consecutiveFailures;
    private Instant cooldownUntil;

    public ProxyRecord(ProxyIdentity identity) {
        this.identity = identity;
    }

    public ProxyIdentity identity() {
        return identity;
    }

    public synchronized boolean isEligible(Instant now) {
        return cooldownUntil == null || !now.isBefore(cooldownUntil);
    }

    public synchronized double healthScore() {
        return healthScore;
    }

    public synchronized Instant cooldownUntil() {
        return cooldownUntil;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    synchronized void markUsed(Instant now) {
        lastUsed = now;
    }

    synchronized void recordSuccess() {
        consecutiveFailures = 0;
        healthScore = Math.min(MAX_HEALTH, healthScore + SUCCESS_RECOVERY);
    }

    /**
     * @return true if this failure put the identity into cooldown
     */
    synchronized boolean recordBlocked(Instant now, int maxConsecutiveFailures, Duration cooldown) {
        healthScore = Math.max(MIN_HEALTH, healthScore / 2.0);
        return countFailure(now, maxConsecutiveFailures, cooldown);
    }

    /**
     * @return true if this failure put the identity into cooldown
     */
    synchronized boolean recordFailure(Instant now, int maxConsecutiveFailures, Duration cooldown) {
        healthScore = Math.max(MIN_HEALTH, healthScore - FAILURE_PENALTY);
        return countFailure(now, maxConsecutiveFailures, cooldown);
    }

    private boolean countFailure(Instant now, int maxConsecutiveFailures, Duration cooldown) {
        consecutiveFailures++;
        if (consecutiveFailures >= maxConsecutiveFailures) {
            cooldownUntil = now.plus(cooldown);
            consecutiveFailures = 0;
            return true;
        }
        return false;
    }

    public synchronized ProxyHealthSnapshot snapshot(Instant now) {
        return new ProxyHealthSnapshot(
            identity.id(),
            healthScore,
            lastUsed,
            consecutiveFailures,
            cooldownUntil,
            cooldownUntil != null && now.isBefore(cooldownUntil)
        );
    }
}
