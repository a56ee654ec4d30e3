package com.spiderjobs.crawl.model;

public record PaginationConfig(PaginationStrategy strategy, String pageParam, int maxPages) {
}
