package com.spiderjobs.crawl.model;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
