package com.spiderjobs.crawl;

import com.spiderjobs.crawl.model.PaginationConfig;
import com.spiderjobs.crawl.model.PaginationStrategy;
import com.spiderjobs.crawl.model.RateLimit;
import com.spiderjobs.crawl.model.RetryPolicy;
import com.spiderjobs.crawl.model.SiteConfig;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public final class TestSites {
    private TestSites() {
    }

    public static SiteConfig site(String siteId, int requests, Duration interval, int maxConcurrency) {
        return new SiteConfig(
            siteId,
            List.of("https://" + siteId + ".example.com/jobs"),
            new RateLimit(requests, interval),
            maxConcurrency,
            "fake",
            2,
            0,
            new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100), 3),
            new PaginationConfig(PaginationStrategy.LINKS, "page", 3),
            Map.of()
        );
    }

    public static SiteConfig site(String siteId) {
        return site(siteId, 100, Duration.ofSeconds(1), 10);
    }

    public static SiteConfig withPagination(SiteConfig site, PaginationConfig pagination) {
        return new SiteConfig(
            site.siteId(),
            site.seedUrls(),
            site.rateLimit(),
            site.maxConcurrency(),
            site.parserId(),
            site.maxDepth(),
            site.priority(),
            site.retryPolicy(),
            pagination,
            site.selectors()
        );
    }

    public static SiteConfig withSeeds(SiteConfig site, List<String> seeds) {
        return new SiteConfig(
            site.siteId(),
            seeds,
            site.rateLimit(),
            site.maxConcurrency(),
            site.parserId(),
            site.maxDepth(),
            site.priority(),
            site.retryPolicy(),
            site.pagination(),
            site.selectors()
        );
    }
}
