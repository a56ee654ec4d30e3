package com.spiderjobs.crawl.api;

import java.util.List;

public record CrawlStartRequest(List<String> siteIds) {
}
