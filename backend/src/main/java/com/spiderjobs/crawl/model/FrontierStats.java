package com.spiderjobs.crawl.model;

public record FrontierStats(String siteId, int ready, int delayed, int inFlight) {
    public int pending() {
        return ready + delayed;
    }
}
