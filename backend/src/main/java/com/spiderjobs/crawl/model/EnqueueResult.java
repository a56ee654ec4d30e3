package com.spiderjobs.crawl.model;

public enum EnqueueResult {
    ADMITTED,
    DUPLICATE,
    DEPTH_EXCEEDED,
    UNKNOWN_SITE,
    INVALID_URL;

    public boolean admitted() {
        return this == ADMITTED;
    }
}
