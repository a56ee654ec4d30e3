package com.spiderjobs.crawl.http;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.model.HttpFetchResult;
import com.spiderjobs.crawl.model.ProxyIdentity;
import com.spiderjobs.crawl.util.FetchOutcomeClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * JDK {@link HttpClient} based fetcher. One client per proxy endpoint; identity headers are
 * applied per request.
 */
@Service
public class HttpPageFetcher implements PageFetcher {
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade", "accept-encoding"
    );

    private final CrawlerProperties properties;
    private final ExecutorService httpExecutor;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public HttpPageFetcher(CrawlerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.httpExecutor = httpExecutor;
    }

    @Override
    public HttpFetchResult fetch(String url, ProxyIdentity identity, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, FetchOutcomeClassifier.INVALID_URL, "URL missing host or malformed");
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET();
            boolean userAgentSet = false;
            for (Map.Entry<String, String> header : identity.headers().entrySet()) {
                String name = header.getKey();
                if (name == null || header.getValue() == null
                    || RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                builder.header(name, header.getValue());
                if ("user-agent".equalsIgnoreCase(name)) {
                    userAgentSet = true;
                }
            }
            if (!userAgentSet) {
                builder.header("User-Agent", properties.getUserAgent());
            }

            HttpResponse<byte[]> response = clientFor(identity).send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, FetchOutcomeClassifier.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, FetchOutcomeClassifier.IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, FetchOutcomeClassifier.INTERRUPTED, e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, FetchOutcomeClassifier.INVALID_URL, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, FetchOutcomeClassifier.HTTP_ERROR, e.getMessage());
        }
    }

    private HttpClient clientFor(ProxyIdentity identity) {
        String key = identity.isDirect() ? "direct" : identity.proxyHost() + ":" + identity.proxyPort();
        return clients.computeIfAbsent(key, ignored -> {
            HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .version(HttpClient.Version.HTTP_1_1)
                .executor(httpExecutor);
            if (!identity.isDirect()) {
                builder.proxy(ProxySelector.of(new InetSocketAddress(identity.proxyHost(), identity.proxyPort())));
            }
            return builder.build();
        });
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
