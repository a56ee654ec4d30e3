package com.spiderjobs.crawl.service;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.breaker.CircuitBreakerRegistry;
import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.governor.PolitenessGovernor;
import com.spiderjobs.crawl.log.CrawlLog;
import com.spiderjobs.crawl.model.CrawlMetricsSnapshot;
import com.spiderjobs.crawl.model.FrontierStats;
import com.spiderjobs.crawl.model.SiteMetrics;
import com.spiderjobs.crawl.proxy.ProxyPool;
import com.spiderjobs.crawl.router.ResultRouter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class CrawlMetricsService {
    private final SiteRegistry siteRegistry;
    private final CrawlLog crawlLog;
    private final CircuitBreakerRegistry breakers;
    private final PolitenessGovernor governor;
    private final Frontier frontier;
    private final ProxyPool proxyPool;
    private final ResultRouter resultRouter;
    private final FetchTaskProcessor processor;
    private final Duration errorWindow;
    private final Clock clock;

    public CrawlMetricsService(
        SiteRegistry siteRegistry,
        CrawlLog crawlLog,
        CircuitBreakerRegistry breakers,
        PolitenessGovernor governor,
        Frontier frontier,
        ProxyPool proxyPool,
        ResultRouter resultRouter,
        FetchTaskProcessor processor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.siteRegistry = siteRegistry;
        this.crawlLog = crawlLog;
        this.breakers = breakers;
        this.governor = governor;
        this.frontier = frontier;
        this.proxyPool = proxyPool;
        this.resultRouter = resultRouter;
        this.processor = processor;
        this.errorWindow = Duration.ofMillis(properties.getBreaker().getWindowMs());
        this.clock = clock;
    }

    public CrawlMetricsSnapshot snapshot() {
        List<SiteMetrics> sites = new ArrayList<>();
        for (String siteId : siteRegistry.siteIds()) {
            FrontierStats stats = frontier.stats(siteId);
            sites.add(new SiteMetrics(
                siteId,
                crawlLog.outcomeCounts(siteId),
                crawlLog.errorRate(siteId, errorWindow),
                breakers.state(siteId),
                governor.backoffMultiplier(siteId),
                governor.isPaused(siteId),
                stats.pending(),
                stats.inFlight()
            ));
        }
        return new CrawlMetricsSnapshot(
            clock.instant(),
            sites,
            proxyPool.snapshot(),
            resultRouter.listingsWritten(),
            resultRouter.listingsDuplicate(),
            resultRouter.listingsLost(),
            processor.tasksDropped()
        );
    }
}
