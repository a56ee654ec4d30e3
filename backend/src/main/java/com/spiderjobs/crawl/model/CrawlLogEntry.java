package com.spiderjobs.crawl.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One fetch attempt. {@code probe} marks a request admitted as a half-open breaker probe.
 */
public record CrawlLogEntry(
    String siteId,
    Instant timestamp,
    FetchOutcome outcome,
    Duration latency,
    String url,
    String identityId,
    int statusCode,
    boolean probe
) {
}
