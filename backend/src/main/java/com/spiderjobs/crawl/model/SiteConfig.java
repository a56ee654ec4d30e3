package com.spiderjobs.crawl.model;

import java.util.List;
import java.util.Map;

public record SiteConfig(
    String siteId,
    List<String> seedUrls,
    RateLimit rateLimit,
    int maxConcurrency,
    String parserId,
    int maxDepth,
    int priority,
    RetryPolicy retryPolicy,
    PaginationConfig pagination,
    Map<String, String> selectors
) {
    public SiteConfig {
        seedUrls = seedUrls == null ? List.of() : List.copyOf(seedUrls);
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
    }
}
