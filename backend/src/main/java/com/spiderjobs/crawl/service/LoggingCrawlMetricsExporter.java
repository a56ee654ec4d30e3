package com.spiderjobs.crawl.service;

import com.spiderjobs.crawl.model.CrawlMetricsSnapshot;
import com.spiderjobs.crawl.model.FetchOutcome;
import com.spiderjobs.crawl.model.ProxyHealthSnapshot;
import com.spiderjobs.crawl.model.SiteMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

@Component
public class LoggingCrawlMetricsExporter implements CrawlMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingCrawlMetricsExporter.class);

    @Override
    public void export(CrawlMetricsSnapshot snapshot) {
        log.info(
            "Crawl metrics at {}: written={}, duplicates={}, lost={}, dropped={}",
            snapshot.capturedAt(),
            snapshot.listingsWritten(),
            snapshot.listingsDuplicate(),
            snapshot.listingsLost(),
            snapshot.tasksDropped()
        );
        for (SiteMetrics site : snapshot.sites()) {
            log.info(
                "Site {}: outcomes={}, errorRate={}, breaker={}, backoff={}x, paused={}, queued={}, inFlight={}",
                site.siteId(),
                nonZero(site.outcomeCounts()),
                String.format("%.2f", site.windowErrorRate()),
                site.breakerState(),
                site.backoffMultiplier(),
                site.paused(),
                site.queueDepth(),
                site.inFlight()
            );
        }
        for (ProxyHealthSnapshot proxy : snapshot.proxies()) {
            log.info(
                "Identity {}: health={}, failures={}, cooling={}",
                proxy.identityId(),
                String.format("%.2f", proxy.healthScore()),
                proxy.consecutiveFailures(),
                proxy.inCooldown()
            );
        }
    }

    private String nonZero(Map<FetchOutcome, Long> counts) {
        return counts.entrySet().stream()
            .filter(entry -> entry.getValue() > 0)
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(",", "{", "}"));
    }
}
