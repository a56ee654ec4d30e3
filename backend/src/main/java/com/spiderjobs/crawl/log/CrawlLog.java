package com.spiderjobs.crawl.log;

import com.spiderjobs.crawl.model.CrawlLogEntry;
import com.spiderjobs.crawl.model.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only record of fetch attempts. Keeps running totals per site and outcome plus a bounded
 * tail of recent entries for rolling-window rates.
 */
@Component
public class CrawlLog {
    private static final Logger log = LoggerFactory.getLogger(CrawlLog.class);
    private static final int RETAINED_PER_SITE = 2000;

    private final List<CrawlLogListener> listeners;
    private final Clock clock;
    private final Map<String, SiteLog> sites = new ConcurrentHashMap<>();
    private final AtomicLong totalEntries = new AtomicLong();

    public CrawlLog(List<CrawlLogListener> listeners, Clock clock) {
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public void append(CrawlLogEntry entry) {
        SiteLog siteLog = sites.computeIfAbsent(entry.siteId(), ignored -> new SiteLog());
        siteLog.counts.get(entry.outcome()).incrementAndGet();
        synchronized (siteLog) {
            siteLog.recent.addLast(entry);
            while (siteLog.recent.size() > RETAINED_PER_SITE) {
                siteLog.recent.removeFirst();
            }
        }
        totalEntries.incrementAndGet();
        if (entry.outcome() == FetchOutcome.SUCCESS) {
            log.debug("site={} outcome={} status={} latencyMs={} url={}",
                entry.siteId(), entry.outcome(), entry.statusCode(), entry.latency().toMillis(), entry.url());
        } else {
            log.info("site={} outcome={} status={} identity={} latencyMs={} url={}",
                entry.siteId(), entry.outcome(), entry.statusCode(), entry.identityId(),
                entry.latency().toMillis(), entry.url());
        }
        for (CrawlLogListener listener : listeners) {
            try {
                listener.onEntry(entry);
            } catch (RuntimeException e) {
                log.warn("Crawl log listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    public Map<FetchOutcome, Long> outcomeCounts(String siteId) {
        Map<FetchOutcome, Long> out = new EnumMap<>(FetchOutcome.class);
        SiteLog siteLog = sites.get(siteId);
        for (FetchOutcome outcome : FetchOutcome.values()) {
            out.put(outcome, siteLog == null ? 0L : siteLog.counts.get(outcome).get());
        }
        return out;
    }

    /**
     * Share of site-level errors among the site's entries in the last {@code window}.
     */
    public double errorRate(String siteId, Duration window) {
        SiteLog siteLog = sites.get(siteId);
        if (siteLog == null) {
            return 0.0;
        }
        Instant cutoff = clock.instant().minus(window);
        int total = 0;
        int errors = 0;
        synchronized (siteLog) {
            Iterator<CrawlLogEntry> it = siteLog.recent.descendingIterator();
            while (it.hasNext()) {
                CrawlLogEntry entry = it.next();
                if (entry.timestamp().isBefore(cutoff)) {
                    break;
                }
                total++;
                if (entry.outcome().countsAsSiteError()) {
                    errors++;
                }
            }
        }
        return total == 0 ? 0.0 : (double) errors / total;
    }

    public List<CrawlLogEntry> recent(String siteId, int limit) {
        SiteLog siteLog = sites.get(siteId);
        if (siteLog == null || limit <= 0) {
            return List.of();
        }
        List<CrawlLogEntry> out = new ArrayList<>();
        synchronized (siteLog) {
            Iterator<CrawlLogEntry> it = siteLog.recent.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
        }
        return out;
    }

    public long totalEntries() {
        return totalEntries.get();
    }

    private static final class SiteLog {
        private final Map<FetchOutcome, AtomicLong> counts = new EnumMap<>(FetchOutcome.class);
        private final Deque<CrawlLogEntry> recent = new ArrayDeque<>();

        private SiteLog() {
            for (FetchOutcome outcome : FetchOutcome.values()) {
                counts.put(outcome, new AtomicLong());
            }
        }
    }
}
