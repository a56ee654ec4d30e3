package com.spiderjobs.crawl.router;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.InMemoryListingSink;
import com.spiderjobs.crawl.MutableClock;
import com.spiderjobs.crawl.TestListings;
import com.spiderjobs.crawl.TestSites;
import com.spiderjobs.crawl.dedup.TwoTierDeduplicationIndex;
import com.spiderjobs.crawl.frontier.Frontier;
import com.spiderjobs.crawl.model.FetchTask;
import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.model.PaginationConfig;
import com.spiderjobs.crawl.model.PaginationStrategy;
import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.service.SiteRegistry;
import com.spiderjobs.crawl.sink.ListingSink;
import com.spiderjobs.crawl.sink.SinkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResultRouterTest {
    private static final String SITE = "alpha";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
    private final ScheduledExecutorService retryScheduler = Executors.newSingleThreadScheduledExecutor();
    private final TwoTierDeduplicationIndex dedup = new TwoTierDeduplicationIndex(1_000, 1_000, 0.001, 1_000);

    private Frontier frontier;

    @AfterEach
    void tearDown() {
        retryScheduler.shutdownNow();
    }

    @Test
    void listingSeenOnTwoPagesIsWrittenOnce() {
        InMemoryListingSink sink = new InMemoryListingSink();
        ResultRouter router = router(TestSites.site(SITE), sink);
        JobListing listing = TestListings.listing(SITE, "Backend Engineer", "Acme", "https://alpha.example.com/job/1");
        JobListing cosmeticCopy = TestListings.listing(SITE, "  backend   ENGINEER ", "ACME", "https://alpha.example.com/job/1");

        RouteSummary first = router.route(task("https://alpha.example.com/jobs?page=1", 0), new ParseResult(List.of(listing), List.of()));
        RouteSummary second = router.route(task("https://alpha.example.com/jobs?page=2", 0), new ParseResult(List.of(cosmeticCopy), List.of()));

        assertThat(first.listingsForwarded()).isEqualTo(1);
        assertThat(second.listingsForwarded()).isZero();
        assertThat(second.listingsDuplicate()).isEqualTo(1);
        assertThat(sink.written()).containsExactly(listing);
        assertThat(router.listingsWritten()).isEqualTo(1);
        assertThat(router.listingsDuplicate()).isEqualTo(1);
    }

    @Test
    void discoveredLinksAreQueuedOneLevelDeeperUpToMaxDepth() {
        ResultRouter router = router(TestSites.site(SITE), new InMemoryListingSink());
        frontier.enqueue(FetchTask.seed("https://alpha.example.com/jobs", SITE, 0, clock.instant()));
        frontier.dequeue(SITE);

        RouteSummary summary = router.route(
            task("https://alpha.example.com/jobs", 0),
            new ParseResult(List.of(), List.of(
                "https://alpha.example.com/jobs",
                "https://alpha.example.com/a",
                "https://alpha.example.com/b#top",
                "https://alpha.example.com/b"
            ))
        );
        RouteSummary tooDeep = router.route(
            task("https://alpha.example.com/deep", 2),
            new ParseResult(List.of(), List.of("https://alpha.example.com/deeper"))
        );

        assertThat(summary.linksAdmitted()).isEqualTo(2);
        assertThat(tooDeep.linksAdmitted()).isZero();
        assertThat(frontier.dequeue(SITE)).map(FetchTask::depth).contains(1);
    }

    @Test
    void pageParamStrategyQueuesTheNextPageUntilMaxPages() {
        SiteConfig site = TestSites.withPagination(
            TestSites.site(SITE),
            new PaginationConfig(PaginationStrategy.PAGE_PARAM, "page", 2)
        );
        ResultRouter router = router(site, new InMemoryListingSink());
        JobListing listing = TestListings.listing(SITE, "Engineer", "Acme", "https://alpha.example.com/job/1");

        RouteSummary page1 = router.route(
            task("https://alpha.example.com/jobs", 0),
            new ParseResult(List.of(listing), List.of("https://alpha.example.com/other"))
        );
        RouteSummary page2 = router.route(
            task("https://alpha.example.com/jobs?page=2", 0),
            new ParseResult(List.of(listing), List.of())
        );

        assertThat(page1.pagesAdmitted()).isEqualTo(1);
        assertThat(page1.linksAdmitted()).isZero();
        assertThat(page2.pagesAdmitted()).isZero();
        FetchTask next = frontier.dequeue(SITE).orElseThrow();
        assertThat(next.url()).isEqualTo("https://alpha.example.com/jobs?page=2");
        assertThat(next.depth()).isZero();
        assertThat(frontier.dequeue(SITE)).isEmpty();
    }

    @Test
    void recrawledFirstPageQueuesTheFollowingPagesAgain() {
        SiteConfig site = TestSites.withPagination(
            TestSites.site(SITE),
            new PaginationConfig(PaginationStrategy.PAGE_PARAM, "page", 3)
        );
        ResultRouter router = router(site, new InMemoryListingSink());
        ParseResult withListing = new ParseResult(
            List.of(TestListings.listing(SITE, "Engineer", "Acme", "https://alpha.example.com/job/1")),
            List.of()
        );

        assertThat(router.route(task("https://alpha.example.com/jobs", 0), withListing).pagesAdmitted()).isEqualTo(1);
        assertThat(router.route(task("https://alpha.example.com/jobs", 0), withListing).pagesAdmitted()).isZero();
        FetchTask page2 = frontier.dequeue(SITE).orElseThrow();
        frontier.complete(page2);

        RouteSummary recrawl = router.route(task("https://alpha.example.com/jobs", 0), withListing);

        assertThat(recrawl.pagesAdmitted()).isEqualTo(1);
        assertThat(frontier.dequeue(SITE)).map(FetchTask::url).contains("https://alpha.example.com/jobs?page=2");
    }

    @Test
    void emptyPageStopsPageParamPagination() {
        SiteConfig site = TestSites.withPagination(
            TestSites.site(SITE),
            new PaginationConfig(PaginationStrategy.PAGE_PARAM, "page", 10)
        );
        ResultRouter router = router(site, new InMemoryListingSink());

        RouteSummary summary = router.route(task("https://alpha.example.com/jobs?page=4", 0), ParseResult.empty());

        assertThat(summary.pagesAdmitted()).isZero();
        assertThat(frontier.pendingCount()).isZero();
    }

    @Test
    void noneStrategyFollowsNothing() {
        SiteConfig site = TestSites.withPagination(
            TestSites.site(SITE),
            new PaginationConfig(PaginationStrategy.NONE, "page", 10)
        );
        ResultRouter router = router(site, new InMemoryListingSink());

        RouteSummary summary = router.route(
            task("https://alpha.example.com/jobs", 0),
            new ParseResult(List.of(), List.of("https://alpha.example.com/a"))
        );

        assertThat(summary.linksAdmitted()).isZero();
        assertThat(frontier.pendingCount()).isZero();
    }

    @Test
    void sinkOutageLosesOnlyTheAffectedListingAfterRetries() throws InterruptedException {
        InMemoryListingSink sink = new InMemoryListingSink(listing -> listing.title().equals("Broken"));
        ResultRouter router = router(TestSites.site(SITE), sink);
        JobListing broken = TestListings.listing(SITE, "Broken", "Acme", "https://alpha.example.com/job/9");
        JobListing fine = TestListings.listing(SITE, "Fine", "Acme", "https://alpha.example.com/job/10");

        router.route(task("https://alpha.example.com/jobs", 0), new ParseResult(List.of(broken, fine), List.of()));

        assertThat(router.awaitPendingWrites(Duration.ofSeconds(5))).isTrue();
        assertThat(sink.written()).containsExactly(fine);
        assertThat(router.listingsLost()).isEqualTo(1);
        assertThat(router.listingsWritten()).isEqualTo(1);
        assertThat(router.pendingWrites()).isZero();
    }

    @Test
    void transientSinkFailureIsRetried() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        InMemoryListingSink delegate = new InMemoryListingSink();
        ListingSink flaky = new ListingSink() {
            @Override
            public void write(JobListing listing) throws SinkException {
                if (calls.incrementAndGet() == 1) {
                    throw new SinkException("connection reset");
                }
                delegate.write(listing);
            }

            @Override
            public String name() {
                return "flaky";
            }
        };
        ResultRouter router = router(TestSites.site(SITE), flaky);
        JobListing listing = TestListings.listing(SITE, "Engineer", "Acme", "https://alpha.example.com/job/1");

        router.route(task("https://alpha.example.com/jobs", 0), new ParseResult(List.of(listing), List.of()));

        assertThat(router.awaitPendingWrites(Duration.ofSeconds(5))).isTrue();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(delegate.written()).containsExactly(listing);
        assertThat(router.listingsLost()).isZero();
    }

    private ResultRouter router(SiteConfig site, ListingSink sink) {
        SiteRegistry registry = new SiteRegistry(List.of(site));
        frontier = new Frontier(registry, dedup, clock);
        CrawlerProperties properties = new CrawlerProperties();
        properties.getSink().setMaxAttempts(3);
        properties.getSink().setBaseBackoffMs(5);
        properties.getSink().setMaxBackoffMs(20);
        return new ResultRouter(frontier, dedup, registry, sink, properties, retryScheduler, clock);
    }

    private FetchTask task(String url, int depth) {
        return FetchTask.discovered(url, SITE, depth, 0, clock.instant());
    }
}
