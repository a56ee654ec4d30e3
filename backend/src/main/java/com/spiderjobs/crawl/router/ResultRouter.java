package com.spiderjobs.crawl.router;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.dedup.DeduplicationIndex;
import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.model.EnqueueResult;
import com.spiderjobs.crawl.model.FetchTask;
import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.model.PaginationConfig;
import com.spiderjobs.crawl.model.PaginationStrategy;
import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.service.SiteRegistry;
import com.spiderjobs.crawl.sink.ListingSink;
import com.spiderjobs.crawl.sink.SinkException;
import com.spiderjobs.crawl.util.HashUtils;
import com.spiderjobs.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends a parse result on: links back to the frontier, new listings to the sink.
 *
 * <p>Content deduplication happens before the sink write and is not undone when the write
 * finally fails, so a listing lost to a sink outage is only recovered by re-fetching its page.
 * Failed writes are retried on {@code sinkRetryScheduler}; {@link #awaitPendingWrites(Duration)}
 * lets a run wait until every write has been acknowledged or given up on.
 */
@Component
public class ResultRouter {
    private static final Logger log = LoggerFactory.getLogger(ResultRouter.class);

    private final Frontier frontier;
    private final DeduplicationIndex deduplicationIndex;
    private final SiteRegistry siteRegistry;
    private final ListingSink sink;
    private final CrawlerProperties.Sink sinkProperties;
    private final ScheduledExecutorService retryScheduler;
    private final Clock clock;

    private final Object pendingLock = new Object();
    private int pendingWrites;

    private final AtomicLong written = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong lost = new AtomicLong();

    public ResultRouter(
        Frontier frontier,
        DeduplicationIndex deduplicationIndex,
        SiteRegistry siteRegistry,
        ListingSink sink,
        CrawlerProperties properties,
        @Qualifier("sinkRetryScheduler") ScheduledExecutorService retryScheduler,
        Clock clock
    ) {
        this.frontier = frontier;
        this.deduplicationIndex = deduplicationIndex;
        this.siteRegistry = siteRegistry;
        this.sink = sink;
        this.sinkProperties = properties.getSink();
        this.retryScheduler = retryScheduler;
        this.clock = clock;
    }

    public RouteSummary route(FetchTask task, ParseResult result) {
        SiteConfig site = siteRegistry.get(task.siteId());
        PaginationConfig pagination = site.pagination();

        int linksAdmitted = 0;
        if (pagination.strategy() == PaginationStrategy.LINKS) {
            for (String link : result.discoveredLinks()) {
                if (offerLink(task, site, link, task.depth() + 1)) {
                    linksAdmitted++;
                }
            }
        }

        int pagesAdmitted = 0;
        if (pagination.strategy() == PaginationStrategy.PAGE_PARAM && !result.listings().isEmpty()) {
            int current = UrlNormalizer.intQueryParam(task.url(), pagination.pageParam(), 1);
            if (current < pagination.maxPages()) {
                String next = UrlNormalizer.withQueryParam(task.url(), pagination.pageParam(), Integer.toString(current + 1));
                if (offerNextPage(task, site, next)) {
                    pagesAdmitted++;
                }
            }
        }

        int forwarded = 0;
        int duplicate = 0;
        for (JobListing listing : result.listings()) {
            String fingerprint = HashUtils.contentFingerprint(listing.title(), listing.company(), listing.canonicalLink());
            if (!deduplicationIndex.markSeenContent(fingerprint)) {
                duplicate++;
                duplicates.incrementAndGet();
                continue;
            }
            forwarded++;
            beginWrite();
            attemptWrite(listing, 1);
        }
        log.debug(
            "Routed {}: links={}, pages={}, listings={}, duplicates={}",
            task.url(), linksAdmitted, pagesAdmitted, forwarded, duplicate
        );
        return new RouteSummary(linksAdmitted, pagesAdmitted, forwarded, duplicate);
    }

    private boolean offerLink(FetchTask parent, SiteConfig site, String link, int depth) {
        if (depth > site.maxDepth()) {
            return false;
        }
        String fingerprint = Frontier.fingerprintOf(link);
        if (fingerprint == null || deduplicationIndex.mightContainUrl(fingerprint)) {
            return false;
        }
        FetchTask child = FetchTask.discovered(link, parent.siteId(), depth, site.priority(), clock.instant());
        return frontier.enqueue(child) == EnqueueResult.ADMITTED;
    }

    /**
     * The next page is re-admitted even when seen before, so a forced re-crawl of the first page
     * walks the whole chain again. Each page yields at most one successor and the chain ends at
     * {@code maxPages} or an empty page.
     */
    private boolean offerNextPage(FetchTask parent, SiteConfig site, String url) {
        FetchTask child = FetchTask.discovered(url, parent.siteId(), parent.depth(), site.priority(), clock.instant());
        return frontier.enqueue(child, true) == EnqueueResult.ADMITTED;
    }

    private void attemptWrite(JobListing listing, int attempt) {
        try {
            sink.write(listing);
            written.incrementAndGet();
            endWrite();
        } catch (SinkException | RuntimeException e) {
            if (attempt >= sinkProperties.getMaxAttempts()) {
                lost.incrementAndGet();
                log.error(
                    "Terminal sink failure for listing {} from {} after {} attempts",
                    listing.canonicalLink(), listing.sourceSite(), attempt, e
                );
                endWrite();
                return;
            }
            long delayMs = backoffMs(attempt);
            log.warn(
                "Sink {} rejected listing {} (attempt {}), retrying in {} ms: {}",
                sink.name(), listing.canonicalLink(), attempt, delayMs, e.getMessage()
            );
            try {
                retryScheduler.schedule(() -> attemptWrite(listing, attempt + 1), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                lost.incrementAndGet();
                log.error("Sink retry scheduler unavailable; listing {} lost", listing.canonicalLink(), rejected);
                endWrite();
            }
        }
    }

    private long backoffMs(int attempt) {
        long base = sinkProperties.getBaseBackoffMs();
        long max = sinkProperties.getMaxBackoffMs();
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = base << shift;
        if (delay < 0 || delay > max) {
            return max;
        }
        return delay;
    }

    private void beginWrite() {
        synchronized (pendingLock) {
            pendingWrites++;
        }
    }

    private void endWrite() {
        synchronized (pendingLock) {
            pendingWrites--;
            if (pendingWrites <= 0) {
                pendingLock.notifyAll();
            }
        }
    }

    public int pendingWrites() {
        synchronized (pendingLock) {
            return pendingWrites;
        }
    }

    /**
     * Waits until no sink write is outstanding.
     *
     * @return false if writes were still pending when the timeout elapsed
     */
    public boolean awaitPendingWrites(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (pendingLock) {
            while (pendingWrites > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                pendingLock.wait(remainingMs);
            }
            return true;
        }
    }

    public long listingsWritten() {
        return written.get();
    }

    public long listingsDuplicate() {
        return duplicates.get();
    }

    public long listingsLost() {
        return lost.get();
    }
}
