package com.spiderjobs.crawl.model;

import java.time.Duration;

public record RateLimit(int requests, Duration interval) {
}
