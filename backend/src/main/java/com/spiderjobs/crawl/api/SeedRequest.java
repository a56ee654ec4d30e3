package com.spiderjobs.crawl.api;

import java.util.List;

public record SeedRequest(List<String> urls, Boolean force) {
}
