package com.spiderjobs.crawl.model;

import java.time.Instant;

public record RawPage(String url, int statusCode, String contentType, String body, Instant fetchedAt) {
    public static RawPage from(HttpFetchResult result) {
        return new RawPage(
            result.finalUrlOrRequested(),
            result.statusCode(),
            result.contentType(),
            result.body(),
            result.fetchedAt()
        );
    }
}
