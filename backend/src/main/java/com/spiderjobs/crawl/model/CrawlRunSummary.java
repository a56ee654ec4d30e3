package com.spiderjobs.crawl.model;

import java.time.Instant;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    long listingsWritten,
    long listingsDuplicate,
    long listingsLost,
    long tasksDropped,
    int tasksRemaining
) {
}
