package com.spiderjobs.crawl.model;

import java.util.List;

public record ParseResult(List<JobListing> listings, List<String> discoveredLinks) {
    public ParseResult {
        listings = listings == null ? List.of() : List.copyOf(listings);
        discoveredLinks = discoveredLinks == null ? List.of() : List.copyOf(discoveredLinks);
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of());
    }
}
