package com.spiderjobs.crawl.service;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.governor.Permit;
import com.spiderjobs.crawl.http.PageFetcher;
import com.spiderjobs.crawl.log.CrawlLog;
import com.spiderjobs.crawl.model.CrawlLogEntry;
import com.spiderjobs.crawl.model.ErrorClass;
import com.spiderjobs.crawl.model.FetchOutcome;
import com.spiderjobs.crawl.model.FetchTask;
import com.spiderjobs.crawl.model.HttpFetchResult;
import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.ProxyIdentity;
import com.spiderjobs.crawl.model.RawPage;
import com.spiderjobs.crawl.model.RetryPolicy;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.parser.ListingParser;
import com.spiderjobs.crawl.parser.ParseException;
import com.spiderjobs.crawl.parser.ParserRegistry;
import com.spiderjobs.crawl.proxy.PoolExhaustedException;
import com.spiderjobs.crawl.proxy.ProxyPool;
import com.spiderjobs.crawl.router.ResultRouter;
import com.spiderjobs.crawl.util.FetchOutcomeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one dequeued task through fetch, classification and routing.
 *
 * <p>Retries never sleep here: a failed task goes back to the frontier with a later
 * {@code notBefore} and the worker moves on. Transient failures spend {@code attemptCount},
 * blocking failures spend the separate {@code blockedCount}. A task that cannot get an identity
 * spends neither, nor does a fetch interrupted by shutdown. A fetcher that throws is treated
 * as a network error.
 */
@Component
public class FetchTaskProcessor {
    private static final Logger log = LoggerFactory.getLogger(FetchTaskProcessor.class);

    private final SiteRegistry siteRegistry;
    private final Frontier frontier;
    private final ProxyPool proxyPool;
    private final PageFetcher pageFetcher;
    private final CrawlLog crawlLog;
    private final ParserRegistry parserRegistry;
    private final ResultRouter resultRouter;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final Map<String, String> lastBlockedIdentity = new ConcurrentHashMap<>();
    private final AtomicBoolean poolExhausted = new AtomicBoolean(false);
    private final AtomicLong tasksDropped = new AtomicLong();
    private final AtomicLong pagesParsed = new AtomicLong();

    public FetchTaskProcessor(
        SiteRegistry siteRegistry,
        Frontier frontier,
        ProxyPool proxyPool,
        PageFetcher pageFetcher,
        CrawlLog crawlLog,
        ParserRegistry parserRegistry,
        ResultRouter resultRouter,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.siteRegistry = siteRegistry;
        this.frontier = frontier;
        this.proxyPool = proxyPool;
        this.pageFetcher = pageFetcher;
        this.crawlLog = crawlLog;
        this.parserRegistry = parserRegistry;
        this.resultRouter = resultRouter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Processes a task the caller dequeued while holding {@code permit}. The permit is always
     * settled and the task always leaves the in-flight set, either rescheduled or completed.
     */
    public void process(FetchTask task, Permit permit) {
        SiteConfig site = siteRegistry.get(task.siteId());
        String fingerprint = Frontier.fingerprintOf(task.url());

        ProxyIdentity identity;
        try {
            identity = proxyPool.select(task.siteId(), fingerprint == null ? null : lastBlockedIdentity.get(fingerprint));
        } catch (PoolExhaustedException e) {
            permit.cancel();
            deferForIdentity(task, e);
            return;
        }
        if (poolExhausted.compareAndSet(true, false)) {
            log.info("Identity pool has eligible identities again");
        }

        HttpFetchResult result;
        try {
            result = pageFetcher.fetch(task.url(), identity, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
        } catch (RuntimeException e) {
            log.warn("Fetch of {} via identity {} failed unexpectedly", task.url(), identity.id(), e);
            result = fetchFailure(task, e);
        } finally {
            permit.release();
        }

        FetchOutcome outcome = FetchOutcomeClassifier.classify(result, properties.getCaptchaPatterns());
        crawlLog.append(new CrawlLogEntry(
            task.siteId(),
            clock.instant(),
            outcome,
            result.duration() == null ? Duration.ZERO : result.duration(),
            task.url(),
            identity.id(),
            result.statusCode(),
            permit.isProbe()
        ));
        if (outcome != FetchOutcome.CANCELLED) {
            proxyPool.reportOutcome(identity, outcome);
        }

        ErrorClass errorClass = FetchOutcomeClassifier.errorClass(outcome);
        switch (errorClass) {
            case SUCCESS -> handleSuccess(task, site, result, fingerprint);
            case TRANSIENT -> handleTransient(task, site.retryPolicy(), outcome, fingerprint);
            case BLOCKING -> handleBlocked(task, site.retryPolicy(), identity, fingerprint);
            case PERMANENT -> drop(task, fingerprint, "permanent outcome " + outcome + " status=" + result.statusCode());
            case CANCELLED -> requeueCancelled(task);
        }
    }

    private HttpFetchResult fetchFailure(FetchTask task, RuntimeException e) {
        return new HttpFetchResult(
            task.url(),
            null,
            0,
            null,
            null,
            clock.instant(),
            Duration.ZERO,
            FetchOutcomeClassifier.FETCH_ERROR,
            e.getClass().getSimpleName() + ": " + e.getMessage()
        );
    }

    private void requeueCancelled(FetchTask task) {
        log.debug("Fetch of {} was interrupted; returning it to the frontier", task.url());
        frontier.reschedule(task.deferredUntil(clock.instant()));
    }

    private void handleSuccess(FetchTask task, SiteConfig site, HttpFetchResult result, String fingerprint) {
        try {
            ListingParser parser = parserRegistry.resolve(site.parserId()).orElse(null);
            if (parser == null) {
                drop(task, fingerprint, "no parser registered as " + site.parserId());
                return;
            }
            ParseResult parsed;
            try {
                parsed = parser.parse(task.siteId(), RawPage.from(result));
            } catch (ParseException e) {
                log.warn("Parse failed for {} on site {}: {}", task.url(), task.siteId(), e.getMessage());
                drop(task, fingerprint, "parse failure");
                return;
            }
            pagesParsed.incrementAndGet();
            resultRouter.route(task, parsed);
        } finally {
            forget(fingerprint);
            frontier.complete(task);
        }
    }

    private void handleTransient(FetchTask task, RetryPolicy policy, FetchOutcome outcome, String fingerprint) {
        int attempts = task.attemptCount() + 1;
        if (attempts >= policy.maxAttempts()) {
            drop(task, fingerprint, "retries exhausted after " + attempts + " attempts, last outcome " + outcome);
            return;
        }
        Duration backoff = policy.backoffFor(attempts);
        log.debug("Retrying {} in {} ms after {} (attempt {})", task.url(), backoff.toMillis(), outcome, attempts);
        frontier.reschedule(task.nextAttempt(clock.instant().plus(backoff)));
    }

    private void handleBlocked(FetchTask task, RetryPolicy policy, ProxyIdentity identity, String fingerprint) {
        int blocked = task.blockedCount() + 1;
        if (blocked >= policy.maxBlockedAttempts()) {
            drop(task, fingerprint, "blocked " + blocked + " times");
            return;
        }
        if (fingerprint != null) {
            lastBlockedIdentity.put(fingerprint, identity.id());
        }
        Duration backoff = policy.backoffFor(blocked);
        log.info("Blocked on {} via identity {}; retrying in {} ms", task.url(), identity.id(), backoff.toMillis());
        frontier.reschedule(task.nextBlockedAttempt(clock.instant().plus(backoff)));
    }

    private void deferForIdentity(FetchTask task, PoolExhaustedException e) {
        Instant now = clock.instant();
        Instant next = e.getNextEligibleAt();
        if (next == null || !next.isAfter(now)) {
            next = now.plusMillis(properties.getIdlePollMs());
        }
        if (poolExhausted.compareAndSet(false, true)) {
            log.warn("Identity pool exhausted, no forward progress until {}", next);
        }
        frontier.reschedule(task.deferredUntil(next));
    }

    private void drop(FetchTask task, String fingerprint, String reason) {
        tasksDropped.incrementAndGet();
        log.warn("Dropping {} for site {}: {}", task.url(), task.siteId(), reason);
        forget(fingerprint);
        frontier.complete(task);
    }

    /**
     * Clears the task from the in-flight set after an unexpected failure.
     */
    public void abandon(FetchTask task, Exception cause) {
        tasksDropped.incrementAndGet();
        log.error("Unexpected failure processing {} for site {}", task.url(), task.siteId(), cause);
        forget(Frontier.fingerprintOf(task.url()));
        frontier.complete(task);
    }

    private void forget(String fingerprint) {
        if (fingerprint != null) {
            lastBlockedIdentity.remove(fingerprint);
        }
    }

    public boolean isPoolExhausted() {
        return poolExhausted.get();
    }

    public long tasksDropped() {
        return tasksDropped.get();
    }

    public long pagesParsed() {
        return pagesParsed.get();
    }
}
