package com.spiderjobs.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlMetricsSnapshot(
    Instant capturedAt,
    List<SiteMetrics> sites,
    List<ProxyHealthSnapshot> proxies,
    long listingsWritten,
    long listingsDuplicate,
    long listingsLost,
    long tasksDropped
) {
}
