package com.spiderjobs.crawl.breaker;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.log.CrawlLogListener;
import com.spiderjobs.crawl.model.BreakerState;
import com.spiderjobs.crawl.model.CrawlLogEntry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CircuitBreakerRegistry implements CrawlLogListener {
    private final CrawlerProperties.Breaker settings;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CrawlerProperties properties, Clock clock) {
        this.settings = properties.getBreaker();
        this.clock = clock;
    }

    public CircuitBreaker breaker(String siteId) {
        return breakers.computeIfAbsent(siteId, id -> new CircuitBreaker(
            id,
            Duration.ofMillis(settings.getWindowMs()),
            settings.getMinimumRequests(),
            settings.getErrorRateThreshold(),
            Duration.ofMillis(settings.getOpenDurationMs()),
            settings.getHalfOpenProbes()
        ));
    }

    public CircuitBreaker.Admission admit(String siteId) {
        return breaker(siteId).admit(clock.instant());
    }

    public void cancelProbe(String siteId) {
        breaker(siteId).cancelProbe();
    }

    public BreakerState state(String siteId) {
        return breaker(siteId).state();
    }

    public Duration remainingOpen(String siteId) {
        return breaker(siteId).remainingOpen(clock.instant());
    }

    public void reset(String siteId) {
        breaker(siteId).reset();
    }

    @Override
    public void onEntry(CrawlLogEntry entry) {
        breaker(entry.siteId()).onOutcome(entry.outcome(), entry.timestamp(), entry.probe());
    }
}
