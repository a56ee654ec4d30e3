package com.spiderjobs.crawl.http;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.model.FetchOutcome;
import com.spiderjobs.crawl.model.HttpFetchResult;
import com.spiderjobs.crawl.model.ProxyIdentity;
import com.spiderjobs.crawl.util.FetchOutcomeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPageFetcherTest {
    private static final ProxyIdentity DIRECT = new ProxyIdentity(
        "direct",
        null,
        null,
        Map.of("User-Agent", "test-agent/1.0", "Accept-Language", "vi-VN", "Connection", "close")
    );

    private MockWebServer server;
    private ExecutorService executor;
    private HttpPageFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        CrawlerProperties properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(5);
        fetcher = new HttpPageFetcher(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsBodyAndSendsIdentityHeaders() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html>Tuyển dụng</html>"));
        String url = server.url("/jobs?page=1").toString();

        HttpFetchResult result = fetcher.fetch(url, DIRECT, Duration.ofSeconds(2));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>Tuyển dụng</html>");
        assertThat(result.contentType()).startsWith("text/html");
        assertThat(result.requestedUrl()).isEqualTo(url);
        assertThat(result.fetchedAt()).isNotNull();
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo("test-agent/1.0");
        assertThat(request.getHeader("Accept-Language")).isEqualTo("vi-VN");
        assertThat(request.getPath()).isEqualTo("/jobs?page=1");
    }

    @Test
    void rateLimitStatusIsReturnedNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        HttpFetchResult result = fetcher.fetch(server.url("/jobs").toString(), DIRECT, Duration.ofSeconds(2));

        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.errorCode()).isNull();
        assertThat(FetchOutcomeClassifier.classify(result, List.of())).isEqualTo(FetchOutcome.BLOCKED);
    }

    @Test
    void slowResponseBecomesATimeout() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        HttpFetchResult result = fetcher.fetch(server.url("/slow").toString(), DIRECT, Duration.ofMillis(300));

        assertThat(result.errorCode()).isEqualTo(FetchOutcomeClassifier.TIMEOUT);
        assertThat(result.statusCode()).isZero();
        assertThat(FetchOutcomeClassifier.classify(result, List.of())).isEqualTo(FetchOutcome.TIMEOUT);
    }

    @Test
    void malformedUrlIsRejectedWithoutARequest() {
        HttpFetchResult result = fetcher.fetch("ftp://example.com/file", DIRECT, Duration.ofSeconds(1));

        assertThat(result.errorCode()).isEqualTo(FetchOutcomeClassifier.INVALID_URL);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void refusedConnectionIsANetworkError() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/gone").toString();
        closed.shutdown();

        HttpFetchResult result = fetcher.fetch(url, DIRECT, Duration.ofSeconds(1));

        assertThat(result.errorCode()).isEqualTo(FetchOutcomeClassifier.IO_ERROR);
        assertThat(FetchOutcomeClassifier.classify(result, List.of())).isEqualTo(FetchOutcome.NETWORK_ERROR);
    }
}
