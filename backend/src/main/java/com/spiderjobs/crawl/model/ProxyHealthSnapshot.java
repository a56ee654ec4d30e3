package com.spiderjobs.crawl.model;

import java.time.Instant;

public record ProxyHealthSnapshot(
    String identityId,
    double healthScore,
    Instant lastUsed,
    int consecutiveFailures,
    Instant cooldownUntil,
    boolean inCooldown
) {
}
