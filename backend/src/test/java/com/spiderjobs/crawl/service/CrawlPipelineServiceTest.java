package com.spiderjobs.crawl.service;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.InMemoryListingSink;
import com.spiderjobs.crawl.TestListings;
import com.spiderjobs.crawl.breaker.CircuitBreakerRegistry;
import com.spiderjobs.crawl.dedup.TwoTierDeduplicationIndex;
import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.frontier.FrontierStore;
import com.spiderjobs.crawl.governor.PolitenessGovernor;
import com.spiderjobs.crawl.log.CrawlLog;
import com.spiderjobs.crawl.model.CrawlRunSummary;
import com.spiderjobs.crawl.model.EnqueueResult;
import com.spiderjobs.crawl.model.FetchTask;
import com.spiderjobs.crawl.model.HttpFetchResult;
import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.model.PaginationConfig;
import com.spiderjobs.crawl.model.PaginationStrategy;
import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.ProxyIdentity;
import com.spiderjobs.crawl.model.RateLimit;
import com.spiderjobs.crawl.model.RawPage;
import com.spiderjobs.crawl.model.RetryPolicy;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.parser.ListingParser;
import com.spiderjobs.crawl.parser.ParserRegistry;
import com.spiderjobs.crawl.proxy.ProxyPool;
import com.spiderjobs.crawl.router.ResultRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CrawlPipelineServiceTest {
    private static final String SITE = "jobs";
    private static final String PAGE_1 = "https://jobs.example.com/list?page=1";
    private static final String PAGE_2 = "https://jobs.example.com/list?page=2";

    private final Clock clock = Clock.systemUTC();
    private final ScheduledExecutorService sinkRetryScheduler = Executors.newSingleThreadScheduledExecutor();
    private final InMemoryListingSink sink = new InMemoryListingSink();
    private final FrontierStore frontierStore = mock(FrontierStore.class);
    private final List<Instant> fetchTimes = Collections.synchronizedList(new ArrayList<>());

    private Frontier frontier;
    private ResultRouter router;
    private CrawlPipelineService pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null && pipeline.isRunning()) {
            pipeline.stop();
        }
        sinkRetryScheduler.shutdownNow();
    }

    @Test
    void crawlsTwoPagesAndWritesEachListingOnce() {
        build(site(List.of(PAGE_1), 2, 2), this::twoPages, properties(false));

        CrawlRunSummary summary = pipeline.runToCompletion(List.of(SITE), Duration.ofSeconds(20));

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.listingsWritten()).isEqualTo(18);
        assertThat(summary.listingsDuplicate()).isEqualTo(2);
        assertThat(summary.listingsLost()).isZero();
        assertThat(summary.tasksRemaining()).isZero();
        assertThat(sink.written()).hasSize(18);
        assertThat(sink.written()).extracting(JobListing::canonicalLink).doesNotHaveDuplicates();
        assertThat(fetchTimes).hasSize(2);
        assertThat(frontier.isDrained()).isTrue();
        assertThat(frontier.inFlightCount()).isZero();
        assertThat(router.pendingWrites()).isZero();
        assertThat(pipeline.isRunning()).isFalse();
        verify(frontierStore, never()).save(anyList());
    }

    @Test
    void neverExceedsTheSiteRateAcrossWorkers() {
        build(site(List.of(chainUrl(0)), 2, 3), this::chain, properties(false));

        CrawlRunSummary summary = pipeline.runToCompletion(List.of(SITE), Duration.ofSeconds(30));

        assertThat(summary.status()).isEqualTo("COMPLETED");
        List<Instant> times = new ArrayList<>(fetchTimes);
        Collections.sort(times);
        assertThat(times).hasSize(6);
        for (int i = 2; i < times.size(); i++) {
            assertThat(Duration.between(times.get(i - 2), times.get(i)))
                .isGreaterThan(Duration.ofMillis(950));
        }
    }

    @Test
    void rejectsASecondStartWhileRunning() {
        CountDownLatch release = new CountDownLatch(1);
        build(site(List.of(PAGE_1), 2, 2), url -> {
            await(release);
            return ParseResult.empty();
        }, properties(false));

        pipeline.start(List.of(SITE));
        try {
            assertThatThrownBy(() -> pipeline.start())
                .isInstanceOf(CrawlAlreadyRunningException.class);
            assertThat(pipeline.activeSites()).containsExactly(SITE);
            assertThat(pipeline.activeWorkerCount()).isEqualTo(3);
        } finally {
            release.countDown();
        }
        assertThat(pipeline.awaitCompletion(Duration.ofSeconds(10))).isTrue();
        assertThat(pipeline.stop().status()).isEqualTo("COMPLETED");
    }

    @Test
    void stopPersistsTasksThatWereNotDispatched() {
        build(site(List.of(PAGE_1), 1, 2), this::twoPages, properties(true));
        pipeline.pause(SITE);

        pipeline.start(List.of(SITE));
        CrawlRunSummary summary = pipeline.stop();

        assertThat(summary.status()).isEqualTo("STOPPED");
        assertThat(summary.tasksRemaining()).isEqualTo(1);
        assertThat(fetchTimes).isEmpty();
        verify(frontierStore).save(List.of(FetchTask.seed(PAGE_1, SITE, 0, summary.startedAt())));
    }

    @Test
    void restoresPersistedTasksOnStart() {
        FetchTask leftover = FetchTask.discovered(PAGE_2, SITE, 1, 0, Instant.parse("2026-01-01T00:00:00Z"));
        when(frontierStore.takeAll()).thenReturn(List.of(leftover));
        CrawlerProperties properties = properties(false);
        properties.getFrontier().setRestoreOnStart(true);
        build(site(List.of(PAGE_1), 2, 2), this::twoPages, properties);

        CrawlRunSummary summary = pipeline.runToCompletion(List.of(SITE), Duration.ofSeconds(20));

        assertThat(summary.listingsWritten()).isEqualTo(18);
        assertThat(fetchTimes).hasSize(2);
    }

    @Test
    void seedReportsPerUrlAdmission() {
        build(site(List.of(PAGE_1), 2, 2), this::twoPages, properties(false));

        Map<String, EnqueueResult> first = pipeline.seed(SITE, List.of(PAGE_1, "not a url"), false);
        Map<String, EnqueueResult> second = pipeline.seed(SITE, List.of(PAGE_1), false);

        assertThat(first).containsEntry(PAGE_1, EnqueueResult.ADMITTED)
            .containsEntry("not a url", EnqueueResult.INVALID_URL);
        assertThat(second).containsEntry(PAGE_1, EnqueueResult.DUPLICATE);
        assertThatThrownBy(() -> pipeline.seed("nope", List.of(PAGE_1), false))
            .isInstanceOf(UnknownSiteException.class);
    }

    private ParseResult twoPages(String url) {
        List<JobListing> listings = new ArrayList<>();
        if (url.endsWith("page=1")) {
            for (int i = 0; i < 10; i++) {
                listings.add(listingFor(i));
            }
            return new ParseResult(listings, List.of(PAGE_2));
        }
        // the first two cards repeat listings from page 1
        for (int i = 8; i < 18; i++) {
            listings.add(listingFor(i));
        }
        return new ParseResult(listings, List.of(PAGE_1));
    }

    private ParseResult chain(String url) {
        int index = Integer.parseInt(url.substring(url.lastIndexOf('=') + 1));
        List<String> links = index < 5 ? List.of(chainUrl(index + 1)) : List.of();
        return new ParseResult(List.of(listingFor(100 + index)), links);
    }

    private static String chainUrl(int index) {
        return "https://jobs.example.com/chain?n=" + index;
    }

    private static JobListing listingFor(int i) {
        return TestListings.listing(SITE, "Engineer " + i, "Company " + i, "https://jobs.example.com/job/" + i);
    }

    private static SiteConfig site(List<String> seeds, int requestsPerSecond, int maxConcurrency) {
        return new SiteConfig(
            SITE,
            seeds,
            new RateLimit(requestsPerSecond, Duration.ofSeconds(1)),
            maxConcurrency,
            "fake",
            6,
            0,
            new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100), 3),
            new PaginationConfig(PaginationStrategy.LINKS, "page", 5),
            Map.of()
        );
    }

    private static CrawlerProperties properties(boolean persistOnStop) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setWorkerCount(3);
        properties.setIdlePollMs(10);
        properties.getFrontier().setPersistOnStop(persistOnStop);
        properties.getFrontier().setRestoreOnStart(false);
        properties.getSink().setBaseBackoffMs(10);
        properties.getSink().setMaxBackoffMs(50);
        return properties;
    }

    private void build(SiteConfig site, PageContent content, CrawlerProperties properties) {
        SiteRegistry registry = new SiteRegistry(List.of(site));
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(properties, clock);
        PolitenessGovernor governor = new PolitenessGovernor(registry, breakers, properties, clock);
        CrawlLog crawlLog = new CrawlLog(List.of(breakers, governor), clock);
        TwoTierDeduplicationIndex dedup = new TwoTierDeduplicationIndex(10_000, 10_000, 0.001, 10_000);
        frontier = new Frontier(registry, dedup, clock);
        ProxyPool proxyPool = new ProxyPool(
            List.of(new ProxyIdentity("direct", null, null, Map.of())), 3, Duration.ofMinutes(1), clock
        );
        router = new ResultRouter(frontier, dedup, registry, sink, properties, sinkRetryScheduler, clock);
        ListingParser parser = new ListingParser() {
            @Override
            public String id() {
                return "fake";
            }

            @Override
            public ParseResult parse(String siteId, RawPage page) {
                return content.parse(page.url());
            }
        };
        FetchTaskProcessor processor = new FetchTaskProcessor(
            registry,
            frontier,
            proxyPool,
            (url, identity, timeout) -> {
                fetchTimes.add(clock.instant());
                return new HttpFetchResult(
                    url, null, 200, "<html>jobs</html>", "text/html",
                    clock.instant(), Duration.ofMillis(1), null, null
                );
            },
            crawlLog,
            new ParserRegistry(List.of(parser)),
            router,
            properties,
            clock
        );
        CrawlMetricsService metrics = new CrawlMetricsService(
            registry, crawlLog, breakers, governor, frontier, proxyPool, router, processor, properties, clock
        );
        pipeline = new CrawlPipelineService(
            properties,
            registry,
            frontier,
            frontierStore,
            governor,
            processor,
            router,
            metrics,
            List.of(new LoggingCrawlMetricsExporter()),
            clock
        );
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface PageContent {
        ParseResult parse(String url);
    }
}
