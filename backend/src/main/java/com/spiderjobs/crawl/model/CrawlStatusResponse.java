package com.spiderjobs.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlStatusResponse(
    boolean running,
    int workerCount,
    Instant startedAt,
    boolean proxyPoolExhausted,
    List<FrontierStats> frontier,
    List<String> pausedSites
) {
}
