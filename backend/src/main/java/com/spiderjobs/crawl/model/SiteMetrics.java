package com.spiderjobs.crawl.model;

import java.util.Map;

public record SiteMetrics(
    String siteId,
    Map<FetchOutcome, Long> outcomeCounts,
    double windowErrorRate,
    BreakerState breakerState,
    double backoffMultiplier,
    boolean paused,
    int queueDepth,
    int inFlight
) {
}
