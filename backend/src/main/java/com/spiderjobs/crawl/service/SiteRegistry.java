package com.spiderjobs.crawl.service;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.model.PaginationConfig;
import com.spiderjobs.crawl.model.PaginationStrategy;
import com.spiderjobs.crawl.model.RateLimit;
import com.spiderjobs.crawl.model.RetryPolicy;
import com.spiderjobs.crawl.model.SiteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Read-only site configuration built once from {@code crawler.sites}.
 */
@Component
public class SiteRegistry {
    private static final Logger log = LoggerFactory.getLogger(SiteRegistry.class);

    private final Map<String, SiteConfig> sites = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    @Autowired
    public SiteRegistry(CrawlerProperties properties) {
        for (CrawlerProperties.Site site : properties.getSites()) {
            register(toSiteConfig(site));
        }
    }

    public SiteRegistry(List<SiteConfig> configs) {
        for (SiteConfig config : configs) {
            register(config);
        }
    }

    private void register(SiteConfig config) {
        if (config.siteId() == null || config.siteId().isBlank()) {
            throw new IllegalArgumentException("site id must not be blank");
        }
        if (sites.putIfAbsent(config.siteId(), config) != null) {
            throw new IllegalArgumentException("duplicate site id: " + config.siteId());
        }
        order.add(config.siteId());
        log.info(
            "Registered site {} parser={} rate={}/{}ms maxDepth={} seeds={}",
            config.siteId(),
            config.parserId(),
            config.rateLimit().requests(),
            config.rateLimit().interval().toMillis(),
            config.maxDepth(),
            config.seedUrls().size()
        );
    }

    public Optional<SiteConfig> find(String siteId) {
        if (siteId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sites.get(siteId));
    }

    public SiteConfig get(String siteId) {
        return find(siteId).orElseThrow(() -> new UnknownSiteException(siteId));
    }

    public List<String> siteIds() {
        return List.copyOf(order);
    }

    public List<SiteConfig> all() {
        List<SiteConfig> out = new ArrayList<>();
        for (String siteId : order) {
            out.add(sites.get(siteId));
        }
        return out;
    }

    public static SiteConfig toSiteConfig(CrawlerProperties.Site site) {
        CrawlerProperties.Retry retry = site.getRetry();
        CrawlerProperties.Pagination pagination = site.getPagination();
        return new SiteConfig(
            site.getSiteId() == null ? null : site.getSiteId().trim(),
            site.getSeedUrls(),
            new RateLimit(site.getRateLimitRequests(), Duration.ofMillis(site.getRateLimitIntervalMs())),
            site.getMaxConcurrency(),
            site.getParserId(),
            site.getMaxDepth(),
            site.getPriority(),
            new RetryPolicy(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseBackoffMs()),
                Duration.ofMillis(retry.getMaxBackoffMs()),
                retry.getMaxBlockedAttempts()
            ),
            new PaginationConfig(
                PaginationStrategy.fromConfig(pagination.getStrategy()),
                pagination.getPageParam(),
                pagination.getMaxPages()
            ),
            site.getSelectors()
        );
    }
}
