package com.spiderjobs.crawl.service;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.frontier.FrontierStore;
import com.spiderjobs.crawl.governor.GovernorDecision;
import com.spiderjobs.crawl.governor.PolitenessGovernor;
import com.spiderjobs.crawl.model.CrawlRunSummary;
import com.spiderjobs.crawl.model.EnqueueResult;
import com.spiderjobs.crawl.model.FetchTask;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.router.ResultRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the worker pool of a crawl run and the start / stop / pause controls.
 *
 * <p>Each worker walks the active sites round-robin, asks the governor for a permit, dequeues
 * one task and hands it to {@link FetchTaskProcessor}. A worker only sleeps when no site had
 * work it was allowed to dispatch, and then no longer than the shortest wait it was told about.
 */
@Service
public class CrawlPipelineService {
    private static final Logger log = LoggerFactory.getLogger(CrawlPipelineService.class);
    private static final long MIN_IDLE_SLEEP_MS = 10;

    private final CrawlerProperties properties;
    private final SiteRegistry siteRegistry;
    private final Frontier frontier;
    private final FrontierStore frontierStore;
    private final PolitenessGovernor governor;
    private final FetchTaskProcessor processor;
    private final ResultRouter resultRouter;
    private final CrawlMetricsService metricsService;
    private final List<CrawlMetricsExporter> exporters;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger siteCursor = new AtomicInteger();
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private volatile int activeWorkerCount;
    private volatile Instant startedAt;
    private volatile List<String> activeSites = List.of();
    private volatile CrawlRunSummary lastSummary;
    private long writtenAtStart;
    private long duplicatesAtStart;
    private long lostAtStart;
    private long droppedAtStart;

    public CrawlPipelineService(
        CrawlerProperties properties,
        SiteRegistry siteRegistry,
        Frontier frontier,
        FrontierStore frontierStore,
        PolitenessGovernor governor,
        FetchTaskProcessor processor,
        ResultRouter resultRouter,
        CrawlMetricsService metricsService,
        List<CrawlMetricsExporter> exporters,
        Clock clock
    ) {
        this.properties = properties;
        this.siteRegistry = siteRegistry;
        this.frontier = frontier;
        this.frontierStore = frontierStore;
        this.governor = governor;
        this.processor = processor;
        this.resultRouter = resultRouter;
        this.metricsService = metricsService;
        this.exporters = exporters;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.isAutoStart() && !properties.getCli().isRun()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        if (running.get()) {
            stop();
        }
    }

    public void start() {
        start(List.of());
    }

    /**
     * Starts workers for the given sites, or for every configured site when empty. Tasks left by
     * a previous run are restored first, then the seed URLs of the active sites are queued.
     */
    public void start(Collection<String> siteIds) {
        synchronized (lifecycleLock) {
            if (running.get()) {
                throw new CrawlAlreadyRunningException("A crawl run is already active since " + startedAt);
            }
            List<String> sites = resolveSites(siteIds);
            if (properties.getFrontier().isRestoreOnStart()) {
                restoreFrontier();
            }
            Instant now = clock.instant();
            int seeded = 0;
            for (String siteId : sites) {
                SiteConfig site = siteRegistry.get(siteId);
                for (String url : site.seedUrls()) {
                    if (frontier.enqueue(FetchTask.seed(url, siteId, site.priority(), now), true) == EnqueueResult.ADMITTED) {
                        seeded++;
                    }
                }
            }

            writtenAtStart = resultRouter.listingsWritten();
            duplicatesAtStart = resultRouter.listingsDuplicate();
            lostAtStart = resultRouter.listingsLost();
            droppedAtStart = processor.tasksDropped();

            int workerCount = properties.getWorkerCount();
            activeWorkerCount = workerCount;
            activeSites = List.copyOf(sites);
            startedAt = now;
            AtomicInteger threadIndex = new AtomicInteger();
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-worker-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                executor.submit(this::workerLoop);
            }
            log.info("Crawl started with {} workers for sites {} ({} seed tasks)", workerCount, sites, seeded);
        }
    }

    /**
     * Stops dispatching, lets in-flight fetches finish, waits for outstanding sink writes and
     * persists the remaining frontier.
     *
     * @return the summary of the run, or of the previous run when none is active
     */
    public CrawlRunSummary stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return lastSummary;
            }
            running.set(false);
            awaitWorkers();
            try {
                if (!resultRouter.awaitPendingWrites(sinkDrainTimeout())) {
                    log.warn("Stopped with {} sink writes still pending", resultRouter.pendingWrites());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            boolean drained = frontier.isDrained();
            int remaining = frontier.pendingCount();
            if (properties.getFrontier().isPersistOnStop() && remaining > 0) {
                persistFrontier();
            }
            CrawlRunSummary summary = new CrawlRunSummary(
                startedAt,
                clock.instant(),
                drained ? "COMPLETED" : "STOPPED",
                resultRouter.listingsWritten() - writtenAtStart,
                resultRouter.listingsDuplicate() - duplicatesAtStart,
                resultRouter.listingsLost() - lostAtStart,
                processor.tasksDropped() - droppedAtStart,
                remaining
            );
            lastSummary = summary;
            activeWorkerCount = 0;
            exportMetrics();
            log.info(
                "Crawl {}: written={}, duplicates={}, lost={}, dropped={}, remaining={}",
                summary.status(), summary.listingsWritten(), summary.listingsDuplicate(),
                summary.listingsLost(), summary.tasksDropped(), summary.tasksRemaining()
            );
            return summary;
        }
    }

    /**
     * Starts a run and stops it once every task and sink write has settled or {@code maxRun}
     * has elapsed.
     */
    public CrawlRunSummary runToCompletion(Collection<String> siteIds, Duration maxRun) {
        start(siteIds);
        awaitCompletion(maxRun);
        return stop();
    }

    /**
     * @return true if the frontier drained and all sink writes settled within {@code timeout}
     */
    public boolean awaitCompletion(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (frontier.isDrained() && resultRouter.pendingWrites() == 0) {
                return true;
            }
            if (!sleep(properties.getIdlePollMs())) {
                return false;
            }
        }
        return frontier.isDrained() && resultRouter.pendingWrites() == 0;
    }

    public Map<String, EnqueueResult> seed(String siteId, List<String> urls, boolean force) {
        SiteConfig site = siteRegistry.get(siteId);
        List<String> targets = urls == null || urls.isEmpty() ? site.seedUrls() : urls;
        Instant now = clock.instant();
        Map<String, EnqueueResult> out = new LinkedHashMap<>();
        for (String url : targets) {
            out.put(url, frontier.enqueue(FetchTask.seed(url, siteId, site.priority(), now), force));
        }
        log.info("Seeded site {} with {} urls (force={})", siteId, targets.size(), force);
        return out;
    }

    public void pause(String siteId) {
        governor.pause(siteId);
    }

    public void resume(String siteId) {
        governor.resume(siteId);
    }

    public boolean isRunning() {
        return running.get();
    }

    public int activeWorkerCount() {
        return activeWorkerCount;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public List<String> activeSites() {
        return activeSites;
    }

    public Optional<CrawlRunSummary> lastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    private void workerLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Duration wait;
            try {
                wait = dispatchOnce();
            } catch (RuntimeException e) {
                log.warn("Crawl worker {} failed between tasks", Thread.currentThread().getName(), e);
                wait = Duration.ofMillis(properties.getIdlePollMs());
            }
            if (wait != null && !sleep(Math.max(MIN_IDLE_SLEEP_MS, wait.toMillis()))) {
                return;
            }
        }
    }

    /**
     * Dispatches at most one task.
     *
     * @return null when a task was processed, otherwise how long to idle
     */
    private Duration dispatchOnce() {
        List<String> sites = activeSites;
        Duration shortest = Duration.ofMillis(properties.getIdlePollMs());
        if (sites.isEmpty()) {
            return shortest;
        }
        int start = Math.floorMod(siteCursor.getAndIncrement(), sites.size());
        for (int i = 0; i < sites.size() && running.get(); i++) {
            String siteId = sites.get((start + i) % sites.size());
            if (!frontier.hasEligible(siteId)) {
                Optional<Instant> next = frontier.nextEligibleAt(siteId);
                if (next.isPresent()) {
                    shortest = min(shortest, Duration.between(clock.instant(), next.get()));
                }
                continue;
            }
            GovernorDecision decision = governor.acquire(siteId);
            if (!decision.isGranted()) {
                shortest = min(shortest, decision.retryAfter());
                continue;
            }
            Optional<FetchTask> task = frontier.dequeue(siteId);
            if (task.isEmpty()) {
                decision.permit().cancel();
                continue;
            }
            try {
                processor.process(task.get(), decision.permit());
            } catch (RuntimeException e) {
                decision.permit().cancel();
                processor.abandon(task.get(), e);
            }
            return null;
        }
        return shortest;
    }

    private List<String> resolveSites(Collection<String> siteIds) {
        if (siteIds == null || siteIds.isEmpty()) {
            return siteRegistry.siteIds();
        }
        List<String> out = new ArrayList<>();
        for (String siteId : siteIds) {
            out.add(siteRegistry.get(siteId).siteId());
        }
        return out;
    }

    private void restoreFrontier() {
        try {
            List<FetchTask> stored = frontierStore.takeAll();
            if (!stored.isEmpty()) {
                int restored = frontier.restore(stored);
                log.info("Restored {} of {} frontier tasks from the previous run", restored, stored.size());
            }
        } catch (DataAccessException e) {
            log.warn("Failed to restore frontier tasks; starting from seeds only", e);
        }
    }

    private void persistFrontier() {
        List<FetchTask> pending = frontier.drainPending();
        try {
            frontierStore.save(pending);
            log.info("Persisted {} frontier tasks for the next run", pending.size());
        } catch (DataAccessException e) {
            log.error("Failed to persist {} frontier tasks; they will be lost", pending.size(), e);
        }
    }

    private void awaitWorkers() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            long graceSeconds = properties.getRequestTimeoutSeconds() + 5L;
            if (!executor.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                log.warn("Crawl workers did not finish within {} s; interrupting", graceSeconds);
                executor.shutdownNow();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    private Duration sinkDrainTimeout() {
        CrawlerProperties.Sink sink = properties.getSink();
        return Duration.ofMillis(sink.getMaxBackoffMs() * sink.getMaxAttempts() + 5_000L);
    }

    private void exportMetrics() {
        for (CrawlMetricsExporter exporter : exporters) {
            try {
                exporter.export(metricsService.snapshot());
            } catch (RuntimeException e) {
                log.warn("Metrics exporter {} failed", exporter.getClass().getSimpleName(), e);
            }
        }
    }

    private static Duration min(Duration a, Duration b) {
        if (b.isNegative()) {
            return Duration.ZERO;
        }
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static boolean sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
